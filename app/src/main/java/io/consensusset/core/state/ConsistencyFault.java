package io.consensusset.core.state;

import io.consensusset.core.diff.LedgerDiff;

/**
 * Fatal ledger integrity violation. Raised when a diff being committed does not match
 * the registries' actual history. Never retried and never handled as a block rejection:
 * the consensus set stops accepting blocks once one has been raised.
 */
public final class ConsistencyFault extends Exception {

    public enum Kind {
        /** ADD of an id already present. */
        DUPLICATE_ENTITY,
        /** REMOVE of an id that is absent. */
        MISSING_ENTITY,
        /** REMOVE whose recorded value differs from the stored one. */
        VALUE_MISMATCH,
        /** Delayed output committed against a maturity height that is not in the future. */
        BAD_MATURITY_HEIGHT,
        /** Siafund pool did not hold the value the pool diff expects. */
        POOL_MISMATCH,
        /** Post-block structural check failed. */
        INVARIANT_VIOLATION,
        /** Durable write of an already committed block failed; memory and disk disagree. */
        PERSISTENCE_FAILURE,
        /** Unexpected runtime failure while a block was being applied. */
        APPLY_FAILURE,
        /** Block processing already stopped by an earlier fault. */
        HALTED
    }

    private final Kind kind;
    private final transient LedgerDiff diff;

    public ConsistencyFault(Kind kind, String message) {
        this(kind, message, (LedgerDiff) null);
    }

    public ConsistencyFault(Kind kind, String message, LedgerDiff diff) {
        super(kind + ": " + message);
        this.kind = kind;
        this.diff = diff;
    }

    public ConsistencyFault(Kind kind, String message, Throwable cause) {
        super(kind + ": " + message, cause);
        this.kind = kind;
        this.diff = null;
    }

    public Kind kind() { return kind; }

    /** The offending diff, if the fault was raised by the commit engine. */
    public LedgerDiff diff() { return diff; }
}
