package io.consensusset.core.notify;

/** Receives ledger changes, synchronously, in the order they were committed. */
@FunctionalInterface
public interface ConsensusSubscriber {

    /** Returning counts as acknowledgement; block acceptance waits for it. */
    void processConsensusChange(ConsensusChange change);
}
