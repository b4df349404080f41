package io.consensusset.core.consensus;

import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.protocol.Block;
import io.consensusset.core.protocol.Hash;

import java.math.BigInteger;
import java.util.List;

/**
 * A header-valid block in the block tree. Diffs are attached the first time the
 * block is applied and kept so the block can later be reverted or re-applied
 * without regenerating them.
 */
public final class BlockNode {
    private final Block block;
    private final BlockNode parent;
    private final long height;
    private final BigInteger cumulativeWork;
    private List<LedgerDiff> diffs;

    private BlockNode(Block block, BlockNode parent, List<LedgerDiff> diffs) {
        this.block = block;
        this.parent = parent;
        this.height = parent == null ? 0L : parent.height + 1;
        BigInteger work = ProofOfWork.calculateBlockWork(block.header());
        this.cumulativeWork = parent == null ? work : parent.cumulativeWork.add(work);
        this.diffs = diffs;
    }

    public static BlockNode genesis(Block block, List<LedgerDiff> diffs) {
        return new BlockNode(block, null, List.copyOf(diffs));
    }

    public static BlockNode child(BlockNode parent, Block block) {
        return new BlockNode(block, parent, null);
    }

    public Block block() { return block; }
    public Hash id() { return block.id(); }
    public BlockNode parent() { return parent; }
    public long height() { return height; }
    public BigInteger cumulativeWork() { return cumulativeWork; }

    public boolean hasDiffs() { return diffs != null; }

    public List<LedgerDiff> diffs() {
        if (diffs == null) throw new IllegalStateException("block " + id().hex() + " was never applied");
        return diffs;
    }

    void attachDiffs(List<LedgerDiff> generated) {
        if (diffs != null) throw new IllegalStateException("diffs already attached to " + id().hex());
        this.diffs = List.copyOf(generated);
    }

    /** True when {@code ancestor} is this node or lies on its parent chain. */
    public boolean descendsFrom(BlockNode ancestor) {
        for (BlockNode n = this; n != null && n.height >= ancestor.height; n = n.parent) {
            if (n == ancestor) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "BlockNode{h=" + height + ", id=" + id().hex().substring(0, 12) + "}";
    }
}
