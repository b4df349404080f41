package io.consensusset.core.state;

import io.consensusset.core.diff.DiffDirection;
import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.protocol.Block;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.storage.ChainStore;
import io.consensusset.core.storage.PathEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Rebuilds ledger state from a chain store by committing every stored best-path
 * block's diff list, genesis first. The ledger at height H is exactly the replay of
 * the diffs of blocks 0..H.
 */
public final class StateReplayer {
    private static final Logger LOG = Logger.getLogger(StateReplayer.class.getName());

    private StateReplayer(){}

    /**
     * Replays the stored path into {@code engine}'s (empty) ledger.
     *
     * @return the replayed path entries, genesis first
     */
    public static List<PathEntry> replay(ChainStore chain, DiffCommitEngine engine) throws ConsistencyFault {
        LedgerState state = engine.state();
        if (state.height() != -1L) {
            throw new IllegalStateException("replay requires an empty ledger, height is " + state.height());
        }

        List<Hash> path = chain.getPath();
        List<PathEntry> entries = new ArrayList<>(path.size());
        Hash expectedParent = Hash.ZERO;
        for (int height = 0; height < path.size(); height++) {
            Hash id = path.get(height);
            Block block = chain.getBlock(id)
                    .orElseThrow(() -> new IllegalStateException("stored path references missing block " + id));
            List<LedgerDiff> diffs = chain.getDiffs(id)
                    .orElseThrow(() -> new IllegalStateException("no diffs stored for path block " + id));
            if (block.header().height() != height || !block.parentId().equals(expectedParent)) {
                throw new IllegalStateException("stored path is not a chain at height " + height);
            }

            engine.commitAll(diffs, DiffDirection.APPLY);
            engine.setHeight(height);

            entries.add(new PathEntry(block, diffs));
            expectedParent = id;
        }

        if (!entries.isEmpty()) {
            LOG.info("Replayed " + entries.size() + " blocks from storage, height " + state.height());
        }
        return entries;
    }
}
