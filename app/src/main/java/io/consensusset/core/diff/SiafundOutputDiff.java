package io.consensusset.core.diff;

import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiafundOutput;

import java.util.Objects;

public record SiafundOutputDiff(DiffDirection direction, Hash id, SiafundOutput output) implements LedgerDiff {
    public SiafundOutputDiff {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(output, "output");
    }

    @Override
    public SiafundOutputDiff inverse() {
        return new SiafundOutputDiff(direction.opposite(), id, output);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
