package io.consensusset.core.protocol;

import java.util.Objects;

/** Spends the siacoin output {@code parentId}, claiming ownership via {@code unlockHash}. */
public record SiacoinInput(Hash parentId, Hash unlockHash) {
    public SiacoinInput {
        Objects.requireNonNull(parentId, "parentId");
        Objects.requireNonNull(unlockHash, "unlockHash");
    }
}
