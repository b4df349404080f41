package io.consensusset.core.consensus;

import io.consensusset.core.protocol.Hash;

import java.util.logging.Logger;

/** Hook into the networking layer, invoked when a peer relays a DoS block. */
@FunctionalInterface
public interface PeerPenalizer {

    /**
     * @param peer    address of the relaying peer, null for locally submitted blocks
     * @param blockId offending block
     * @param reason  human-readable rejection message
     */
    void penalize(String peer, Hash blockId, String reason);

    /** Penalizer that only records the event in the log. */
    static PeerPenalizer logging() {
        Logger log = Logger.getLogger(PeerPenalizer.class.getName());
        return (peer, blockId, reason) ->
                log.warning("Penalizing peer " + peer + " for block " + blockId.hex() + ": " + reason);
    }
}
