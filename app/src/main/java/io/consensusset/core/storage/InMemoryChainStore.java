package io.consensusset.core.storage;

import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.protocol.Block;
import io.consensusset.core.protocol.Hash;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Simple, fast in-memory chain store.
 * Good for tests and local nodes that do not need to survive a restart.
 */
public final class InMemoryChainStore implements ChainStore {

    /** Map: blockId -> Block */
    private final Map<Hash, Block> blocks = new HashMap<>();

    /** Map: blockId -> diffs recorded when the block joined the best path */
    private final Map<Hash, List<LedgerDiff>> diffs = new HashMap<>();

    /** Best path, index = height */
    private final List<Hash> path = new ArrayList<>();

    @Override
    public synchronized void putBlock(Block block) {
        if (block == null) return;
        blocks.putIfAbsent(block.id(), block);
    }

    @Override
    public synchronized Optional<Block> getBlock(Hash blockId) {
        if (blockId == null) return Optional.empty();
        return Optional.ofNullable(blocks.get(blockId));
    }

    @Override
    public synchronized Optional<List<LedgerDiff>> getDiffs(Hash blockId) {
        if (blockId == null) return Optional.empty();
        return Optional.ofNullable(diffs.get(blockId));
    }

    @Override
    public synchronized void commitPath(long forkHeight, List<PathEntry> applied) {
        if (forkHeight < -1 || forkHeight >= path.size()) {
            throw new IllegalArgumentException("fork height " + forkHeight + " outside stored path of " + path.size());
        }
        long expected = forkHeight + 1;
        for (PathEntry entry : applied) {
            if (entry.height() != expected++) {
                throw new IllegalArgumentException("path entries must be contiguous from height " + (forkHeight + 1));
            }
        }
        while (path.size() > forkHeight + 1) {
            path.remove(path.size() - 1);
        }
        for (PathEntry entry : applied) {
            Hash id = entry.block().id();
            blocks.putIfAbsent(id, entry.block());
            diffs.put(id, entry.diffs());
            path.add(id);
        }
    }

    @Override
    public synchronized List<Hash> getPath() {
        return List.copyOf(path);
    }

    @Override
    public synchronized long size() {
        return blocks.size();
    }
}
