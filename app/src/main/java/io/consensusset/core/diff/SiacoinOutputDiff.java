package io.consensusset.core.diff;

import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;

import java.util.Objects;

public record SiacoinOutputDiff(DiffDirection direction, Hash id, SiacoinOutput output) implements LedgerDiff {
    public SiacoinOutputDiff {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(output, "output");
    }

    @Override
    public SiacoinOutputDiff inverse() {
        return new SiacoinOutputDiff(direction.opposite(), id, output);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
