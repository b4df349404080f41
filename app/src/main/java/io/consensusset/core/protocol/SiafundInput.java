package io.consensusset.core.protocol;

import java.util.Objects;

/** Spends a siafund output; the accrued claim is paid to {@code claimUnlockHash}. */
public record SiafundInput(Hash parentId, Hash unlockHash, Hash claimUnlockHash) {
    public SiafundInput {
        Objects.requireNonNull(parentId, "parentId");
        Objects.requireNonNull(unlockHash, "unlockHash");
        Objects.requireNonNull(claimUnlockHash, "claimUnlockHash");
    }
}
