package io.consensusset.core.notify;

/**
 * Delivery tiers, notified in declaration order. A later tier may rely on every
 * subscriber of an earlier tier having processed the same change.
 */
public enum SubscriberTier {
    /** Direct consumers of ledger changes (wallets, explorers). */
    CONSENSUS,
    /** The transaction pool, which reconciles its contents against the new tip. */
    TRANSACTION_POOL,
    /** Consumers that read the transaction pool's state. */
    POOL_DEPENDENT
}
