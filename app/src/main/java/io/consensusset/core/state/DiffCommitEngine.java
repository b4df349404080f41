package io.consensusset.core.state;

import io.consensusset.core.diff.DelayedSiacoinOutputDiff;
import io.consensusset.core.diff.DiffDirection;
import io.consensusset.core.diff.FileContractDiff;
import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.diff.SiacoinOutputDiff;
import io.consensusset.core.diff.SiafundOutputDiff;
import io.consensusset.core.diff.SiafundPoolDiff;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Applies or reverts single diffs against a {@link LedgerState}.
 *
 * <p>Every kind follows one rule: the effective operation is ADD when the diff's own
 * direction equals the commit direction, REMOVE otherwise. Reverting a diff is therefore
 * the same code path as applying its inverse. ADD requires the id to be absent; REMOVE
 * requires it present with an equal value. Any violation means the diff list does not
 * match the ledger's history and is reported as a {@link ConsistencyFault}.
 */
public final class DiffCommitEngine {

    private final LedgerState state;

    public DiffCommitEngine(LedgerState state) {
        this.state = state;
    }

    public LedgerState state() {
        return state;
    }

    /** Moves the ledger's tip height; callers do this around whole-block commits only. */
    public void setHeight(long height) {
        state.setHeight(height);
    }

    public void commit(LedgerDiff diff, DiffDirection commitDirection) throws ConsistencyFault {
        if (diff instanceof SiacoinOutputDiff) {
            commitSiacoinOutputDiff((SiacoinOutputDiff) diff, commitDirection);
        } else if (diff instanceof SiafundOutputDiff) {
            commitSiafundOutputDiff((SiafundOutputDiff) diff, commitDirection);
        } else if (diff instanceof FileContractDiff) {
            commitFileContractDiff((FileContractDiff) diff, commitDirection);
        } else if (diff instanceof DelayedSiacoinOutputDiff) {
            commitDelayedSiacoinOutputDiff((DelayedSiacoinOutputDiff) diff, commitDirection);
        } else if (diff instanceof SiafundPoolDiff) {
            commitSiafundPoolDiff((SiafundPoolDiff) diff, commitDirection);
        } else {
            throw new IllegalArgumentException("Unknown diff type: " + diff);
        }
    }

    /**
     * Commits a block's diff list: front to back for APPLY, back to front for REVERT,
     * so that reverting exactly unwinds a previous apply.
     */
    public void commitAll(List<LedgerDiff> diffs, DiffDirection commitDirection) throws ConsistencyFault {
        if (commitDirection == DiffDirection.APPLY) {
            for (LedgerDiff diff : diffs) {
                commit(diff, DiffDirection.APPLY);
            }
        } else {
            for (int i = diffs.size() - 1; i >= 0; i--) {
                commit(diffs.get(i), DiffDirection.REVERT);
            }
        }
    }

    public void commitSiacoinOutputDiff(SiacoinOutputDiff diff, DiffDirection commitDirection) throws ConsistencyFault {
        addOrRemove(state.siacoinRegistry(), diff.id(), diff.output(), isAdd(diff, commitDirection), diff, "siacoin output");
    }

    public void commitSiafundOutputDiff(SiafundOutputDiff diff, DiffDirection commitDirection) throws ConsistencyFault {
        addOrRemove(state.siafundRegistry(), diff.id(), diff.output(), isAdd(diff, commitDirection), diff, "siafund output");
    }

    public void commitFileContractDiff(FileContractDiff diff, DiffDirection commitDirection) throws ConsistencyFault {
        addOrRemove(state.contractRegistry(), diff.id(), diff.contract(), isAdd(diff, commitDirection), diff, "file contract");
    }

    /**
     * Maturity height is checked first, in both directions, and before any existence
     * check: a delayed output may only be touched while its maturity is in the future.
     */
    public void commitDelayedSiacoinOutputDiff(DelayedSiacoinOutputDiff diff, DiffDirection commitDirection)
            throws ConsistencyFault {
        long maturity = diff.maturityHeight();
        if (maturity <= state.height()) {
            throw new ConsistencyFault(ConsistencyFault.Kind.BAD_MATURITY_HEIGHT,
                    "maturity height " + maturity + " is not above current height " + state.height(), diff);
        }
        MaturityQueue queue = state.maturityQueue();
        if (isAdd(diff, commitDirection)) {
            addOrRemove(queue.bucket(maturity), diff.id(), diff.output(), true, diff, "delayed siacoin output");
            return;
        }
        Optional<LedgerRegistry<SiacoinOutput>> bucket = queue.existingBucket(maturity);
        if (bucket.isEmpty()) {
            throw new ConsistencyFault(ConsistencyFault.Kind.MISSING_ENTITY,
                    "no delayed outputs at height " + maturity + " (removing " + diff.id() + ")", diff);
        }
        addOrRemove(bucket.get(), diff.id(), diff.output(), false, diff, "delayed siacoin output");
        queue.dropIfEmpty(maturity);
    }

    public void commitSiafundPoolDiff(SiafundPoolDiff diff, DiffDirection commitDirection) throws ConsistencyFault {
        BigInteger expected;
        BigInteger next;
        if (isAdd(diff, commitDirection)) {
            expected = diff.previous();
            next = diff.adjusted();
        } else {
            expected = diff.adjusted();
            next = diff.previous();
        }
        if (state.siafundPool().compareTo(expected) != 0) {
            throw new ConsistencyFault(ConsistencyFault.Kind.POOL_MISMATCH,
                    "siafund pool is " + state.siafundPool() + ", diff expects " + expected, diff);
        }
        state.setSiafundPool(next);
    }

    private static boolean isAdd(LedgerDiff diff, DiffDirection commitDirection) {
        return diff.direction() == commitDirection;
    }

    private static <V> void addOrRemove(LedgerRegistry<V> registry,
                                        Hash id,
                                        V value,
                                        boolean add,
                                        LedgerDiff diff,
                                        String what) throws ConsistencyFault {
        if (add) {
            if (!registry.insertIfAbsent(id, value)) {
                throw new ConsistencyFault(ConsistencyFault.Kind.DUPLICATE_ENTITY,
                        what + " " + id + " already exists", diff);
            }
            return;
        }
        Optional<V> existing = registry.get(id);
        if (existing.isEmpty()) {
            throw new ConsistencyFault(ConsistencyFault.Kind.MISSING_ENTITY,
                    what + " " + id + " does not exist", diff);
        }
        if (!existing.get().equals(value)) {
            throw new ConsistencyFault(ConsistencyFault.Kind.VALUE_MISMATCH,
                    what + " " + id + " holds a different value than the diff records", diff);
        }
        registry.removeIfPresent(id);
    }
}
