package io.consensusset.core.protocol;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Storage agreement. The payout is locked until either a storage proof is submitted
 * inside [windowStart, windowEnd) or the window closes, at which point the valid or
 * missed proof outputs are created as delayed outputs.
 */
public record FileContract(long fileSize,
                           Hash fileMerkleRoot,
                           long windowStart,
                           long windowEnd,
                           BigInteger payout,
                           List<SiacoinOutput> validProofOutputs,
                           List<SiacoinOutput> missedProofOutputs,
                           Hash unlockHash,
                           long revisionNumber) {
    public FileContract {
        Objects.requireNonNull(fileMerkleRoot, "fileMerkleRoot");
        Objects.requireNonNull(payout, "payout");
        Objects.requireNonNull(unlockHash, "unlockHash");
        validProofOutputs = List.copyOf(validProofOutputs);
        missedProofOutputs = List.copyOf(missedProofOutputs);
        if (payout.signum() < 0) throw new IllegalArgumentException("payout must be >= 0");
    }

    /** Contract with only a payout set; used where terms are irrelevant. */
    public static FileContract withPayout(long payout) {
        return new FileContract(0L, Hash.ZERO, 0L, 0L, BigInteger.valueOf(payout),
                List.of(), List.of(), Hash.ZERO, 0L);
    }
}
