package io.consensusset.core.consensus;

import io.consensusset.core.protocol.Hash;

/**
 * A candidate block was not adopted. Ledger state is unchanged. Only {@link Reason#DOS_BLOCK}
 * indicates misbehaviour by the peer that relayed the block.
 */
public final class BlockRejectedException extends Exception {

    public enum Reason {
        /** Parent is not known. */
        ORPHAN,
        /** Block was seen before. */
        KNOWN,
        /** Header rules failed (height, merkle root, work, timestamp). */
        INVALID_HEADER,
        /** Miner payouts do not add up to subsidy plus fees. */
        INVALID_PAYOUTS,
        /** A transaction failed validation against the ledger. */
        INVALID_TRANSACTION,
        /** Costly-but-invalid pattern: a transaction funded but never spent. */
        DOS_BLOCK,
        /** Valid, stored, but its branch does not carry more work than the best path. */
        NON_EXTENDING
    }

    private final Reason reason;
    private final Hash blockId;

    public BlockRejectedException(Reason reason, String message) {
        this(reason, message, null);
    }

    public BlockRejectedException(Reason reason, String message, Hash blockId) {
        super(message);
        this.reason = reason;
        this.blockId = blockId;
    }

    public Reason reason() { return reason; }

    /** Block that failed; null when the failure is not tied to a specific block yet. */
    public Hash blockId() { return blockId; }

    public boolean isPenalizing() {
        return reason == Reason.DOS_BLOCK;
    }

    /** Same rejection attributed to {@code id}. */
    public BlockRejectedException forBlock(Hash id) {
        BlockRejectedException e = new BlockRejectedException(reason, getMessage(), id);
        e.initCause(this);
        return e;
    }

    @Override
    public String toString() {
        return "BlockRejectedException[" + reason + "]: " + getMessage();
    }
}
