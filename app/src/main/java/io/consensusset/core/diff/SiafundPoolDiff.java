package io.consensusset.core.diff;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Moves the siafund pool between two values. Committed with its own direction the pool
 * goes {@code previous -> adjusted}; with the opposite direction it goes back.
 */
public record SiafundPoolDiff(DiffDirection direction, BigInteger previous, BigInteger adjusted) implements LedgerDiff {
    public SiafundPoolDiff {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(adjusted, "adjusted");
        if (previous.signum() < 0 || adjusted.signum() < 0) {
            throw new IllegalArgumentException("pool values must be >= 0");
        }
    }

    @Override
    public SiafundPoolDiff inverse() {
        return new SiafundPoolDiff(direction.opposite(), previous, adjusted);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
