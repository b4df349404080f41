package io.consensusset.core.protocol;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A siafund share. {@code claimStart} is the siafund pool value at the moment the
 * output was created; the holder's claim is the pool growth since then.
 */
public record SiafundOutput(BigInteger value, Hash unlockHash, BigInteger claimStart) {
    public SiafundOutput {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(unlockHash, "unlockHash");
        Objects.requireNonNull(claimStart, "claimStart");
        if (value.signum() < 0) throw new IllegalArgumentException("value must be >= 0");
        if (claimStart.signum() < 0) throw new IllegalArgumentException("claimStart must be >= 0");
    }

    public static SiafundOutput of(long value, Hash unlockHash) {
        return new SiafundOutput(BigInteger.valueOf(value), unlockHash, BigInteger.ZERO);
    }

    public SiafundOutput withClaimStart(BigInteger pool) {
        return new SiafundOutput(value, unlockHash, pool);
    }
}
