package io.consensusset.core.protocol;

/** Decoder sanity caps. */
public final class ProtocolLimits {
    private ProtocolLimits() {}

    public static final int MAX_TXS_PER_BLOCK = 100_000;
    public static final int MAX_ELEMENTS_PER_LIST = 1_000_000;
    public static final int MAX_CURRENCY_BYTES = 64;
    public static final int MAX_BLOCK_BYTES = 64 * 1024 * 1024;
}
