package io.consensusset.core.protocol;

import java.math.BigInteger;
import java.util.Objects;

/** A spendable coin balance: value in minor units and the hash of its unlock conditions. */
public record SiacoinOutput(BigInteger value, Hash unlockHash) {
    public SiacoinOutput {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(unlockHash, "unlockHash");
        if (value.signum() < 0) throw new IllegalArgumentException("value must be >= 0");
    }

    public static SiacoinOutput of(long value, Hash unlockHash) {
        return new SiacoinOutput(BigInteger.valueOf(value), unlockHash);
    }
}
