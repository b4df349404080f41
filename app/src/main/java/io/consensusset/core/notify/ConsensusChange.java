package io.consensusset.core.notify;

import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.protocol.Hash;

import java.util.List;

/**
 * One committed step of the best path.
 *
 * @param revertedBlocks blocks taken off the path, old tip first
 * @param appliedBlocks  blocks added to the path, lowest first
 * @param diffs          net effect in commit order; diffs of reverted blocks are already
 *                       inverted, so every entry can be read (or committed) as APPLY
 * @param height         height of the new tip
 */
public record ConsensusChange(List<Hash> revertedBlocks,
                              List<Hash> appliedBlocks,
                              List<LedgerDiff> diffs,
                              long height) {
    public ConsensusChange {
        revertedBlocks = List.copyOf(revertedBlocks);
        appliedBlocks = List.copyOf(appliedBlocks);
        diffs = List.copyOf(diffs);
    }

    public boolean isReorg() {
        return !revertedBlocks.isEmpty();
    }
}
