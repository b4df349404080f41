package io.consensusset.core.storage;

import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.protocol.Block;
import io.consensusset.core.protocol.Hash;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage behind the consensus set.
 *
 * Contract:
 * - {@link #commitPath} is all-or-nothing: after a crash either the whole call is
 *   visible or none of it is, so the stored path and diffs never disagree.
 * - Blocks and diffs read back are equal to what was written (and re-encode to the
 *   same bytes).
 */
public interface ChainStore {

    /** Persist a block body (idempotent). Side-chain blocks are stored too. */
    void putBlock(Block block);

    /** Fetch a block by its id. */
    Optional<Block> getBlock(Hash blockId);

    /** Diff list recorded for a best-path block. */
    Optional<List<LedgerDiff>> getDiffs(Hash blockId);

    /**
     * Atomically truncate the best path to {@code forkHeight} (inclusive; -1 drops
     * everything) and append {@code applied}, storing each entry's block and diffs.
     */
    void commitPath(long forkHeight, List<PathEntry> applied);

    /** Best path block ids, genesis first. */
    List<Hash> getPath();

    /** Tip of the best path, if any. */
    default Optional<Hash> getHead() {
        List<Hash> path = getPath();
        return path.isEmpty() ? Optional.empty() : Optional.of(path.get(path.size() - 1));
    }

    /** Number of blocks stored (debug/metrics). */
    long size();
}
