package io.consensusset.core.consensus;

import io.consensusset.core.protocol.Transaction;
import io.consensusset.core.state.LedgerView;

/**
 * Transaction validity oracle. Called once per transaction while a block is being
 * applied, against the ledger as left by the transactions before it.
 */
public interface TransactionValidator {

    /**
     * @param height height of the block containing {@code tx}
     * @throws BlockRejectedException with reason INVALID_TRANSACTION, or DOS_BLOCK for
     *                                invalid patterns that were expensive to produce
     */
    void validate(Transaction tx, LedgerView ledger, long height) throws BlockRejectedException;
}
