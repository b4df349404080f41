package io.consensusset.core.diff;

import io.consensusset.core.protocol.FileContract;
import io.consensusset.core.protocol.Hash;

import java.util.Objects;

public record FileContractDiff(DiffDirection direction, Hash id, FileContract contract) implements LedgerDiff {
    public FileContractDiff {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(contract, "contract");
    }

    @Override
    public FileContractDiff inverse() {
        return new FileContractDiff(direction.opposite(), id, contract);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
