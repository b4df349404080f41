package io.consensusset.core.storage;

import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.protocol.Block;

import java.util.List;
import java.util.Objects;

/** A best-path block together with the ordered diff list its application produced. */
public record PathEntry(Block block, List<LedgerDiff> diffs) {
    public PathEntry {
        Objects.requireNonNull(block, "block");
        diffs = List.copyOf(diffs);
    }

    public long height() {
        return block.header().height();
    }
}
