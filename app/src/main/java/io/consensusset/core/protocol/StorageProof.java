package io.consensusset.core.protocol;

import java.util.Objects;

/** Proof of storage for contract {@code parentId}. Segment verification is not modelled. */
public record StorageProof(Hash parentId) {
    public StorageProof {
        Objects.requireNonNull(parentId, "parentId");
    }
}
