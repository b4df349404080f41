package io.consensusset.core.protocol;

import java.nio.charset.StandardCharsets;

/** 16-byte domain separators mixed into derived identifiers. */
public enum Specifier {
    SIACOIN_OUTPUT("siacoin output"),
    SIAFUND_OUTPUT("siafund output"),
    FILE_CONTRACT("file contract"),
    STORAGE_PROOF_VALID("storage proof"),
    STORAGE_PROOF_MISSED("missed proof"),
    MINER_PAYOUT("miner payout"),
    SIAFUND_CLAIM("claim output");

    public static final int LENGTH = 16;

    private final byte[] bytes;

    Specifier(String label) {
        byte[] raw = label.getBytes(StandardCharsets.US_ASCII);
        this.bytes = new byte[LENGTH];
        System.arraycopy(raw, 0, this.bytes, 0, Math.min(raw.length, LENGTH));
    }

    public byte[] bytes() { return bytes.clone(); }
}
