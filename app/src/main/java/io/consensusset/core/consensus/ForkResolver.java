package io.consensusset.core.consensus;

import io.consensusset.core.diff.DiffDirection;
import io.consensusset.core.state.ConsistencyFault;
import io.consensusset.core.state.DiffCommitEngine;
import io.consensusset.core.state.LedgerState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Moves the ledger from one tip to another: reverts back to the common ancestor,
 * then applies the target branch forward. Extending the current tip is the special
 * case with nothing to revert.
 */
public final class ForkResolver {
    private static final Logger LOG = Logger.getLogger(ForkResolver.class.getName());

    /**
     * Outcome of a successful switch.
     *
     * @param ancestor common ancestor of the old and new tips
     * @param reverted old-branch nodes, in the order they were reverted (old tip first)
     * @param applied  new-branch nodes, in the order they were applied (lowest first)
     */
    public record Result(BlockNode ancestor, List<BlockNode> reverted, List<BlockNode> applied) {
        public Result {
            reverted = List.copyOf(reverted);
            applied = List.copyOf(applied);
        }
    }

    private final DiffCommitEngine engine;
    private final DiffGenerator generator;

    public ForkResolver(DiffCommitEngine engine, DiffGenerator generator) {
        this.engine = engine;
        this.generator = generator;
    }

    /**
     * Switches the ledger from {@code currentTip} to {@code target}. If a block on the
     * new branch is rejected or fails unexpectedly, the partial switch is undone and the
     * old branch restored before the exception (a rejection attributed to the failing
     * block) propagates.
     */
    public Result switchTo(BlockNode currentTip, BlockNode target) throws BlockRejectedException, ConsistencyFault {
        BlockNode ancestor = commonAncestor(currentTip, target);

        List<BlockNode> reverted = new ArrayList<>();
        for (BlockNode n = currentTip; n != ancestor; n = n.parent()) {
            reverted.add(n);
        }
        List<BlockNode> branch = new ArrayList<>();
        for (BlockNode n = target; n != ancestor; n = n.parent()) {
            branch.add(n);
        }
        Collections.reverse(branch);

        for (BlockNode n : reverted) {
            revert(n);
        }

        List<BlockNode> applied = new ArrayList<>();
        try {
            for (BlockNode n : branch) {
                apply(n);
                applied.add(n);
            }
        } catch (BlockRejectedException | RuntimeException e) {
            LOG.fine("Branch to " + target + " failed at height " + (ancestor.height() + applied.size() + 1)
                    + ", restoring " + currentTip);
            for (int i = applied.size() - 1; i >= 0; i--) {
                revert(applied.get(i));
            }
            for (int i = reverted.size() - 1; i >= 0; i--) {
                apply(reverted.get(i));
            }
            throw e;
        }
        return new Result(ancestor, reverted, applied);
    }

    /** Reverts a block: height drops first, then its diffs are unwound back to front. */
    public void revert(BlockNode node) throws ConsistencyFault {
        LedgerState state = engine.state();
        if (state.height() != node.height()) {
            throw new IllegalStateException("reverting " + node + " with ledger at height " + state.height());
        }
        engine.setHeight(node.height() - 1);
        engine.commitAll(node.diffs(), DiffDirection.REVERT);
    }

    /** Applies a block, generating its diffs on first use; height rises only after every diff commits. */
    void apply(BlockNode node) throws BlockRejectedException, ConsistencyFault {
        if (node.hasDiffs()) {
            engine.commitAll(node.diffs(), DiffDirection.APPLY);
        } else {
            node.attachDiffs(generator.generateAndApply(node.block(), node.height()));
        }
        engine.setHeight(node.height());
    }

    static BlockNode commonAncestor(BlockNode a, BlockNode b) {
        while (a.height() > b.height()) a = a.parent();
        while (b.height() > a.height()) b = b.parent();
        while (a != b) {
            a = a.parent();
            b = b.parent();
        }
        return a;
    }
}
