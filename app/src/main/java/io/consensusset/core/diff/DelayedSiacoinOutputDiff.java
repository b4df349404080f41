package io.consensusset.core.diff;

import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;

import java.util.Objects;

/**
 * A coin output parked in the maturity queue until the chain reaches
 * {@code maturityHeight}. Contract payouts, siafund claims and miner payouts all
 * pass through here.
 */
public record DelayedSiacoinOutputDiff(DiffDirection direction,
                                       Hash id,
                                       SiacoinOutput output,
                                       long maturityHeight) implements LedgerDiff {
    public DelayedSiacoinOutputDiff {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(output, "output");
    }

    @Override
    public DelayedSiacoinOutputDiff inverse() {
        return new DelayedSiacoinOutputDiff(direction.opposite(), id, output, maturityHeight);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
