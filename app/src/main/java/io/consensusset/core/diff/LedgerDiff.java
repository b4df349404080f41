package io.consensusset.core.diff;

/**
 * One atomic, reversible ledger mutation. Implementations are immutable values;
 * a block's ordered list of them is enough to apply or unwind the block exactly.
 */
public interface LedgerDiff {

    DiffDirection direction();

    /** Same diff with its face-value direction flipped. */
    LedgerDiff inverse();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visit(SiacoinOutputDiff diff);
        R visit(SiafundOutputDiff diff);
        R visit(FileContractDiff diff);
        R visit(DelayedSiacoinOutputDiff diff);
        R visit(SiafundPoolDiff diff);
    }
}
