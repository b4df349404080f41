package io.consensusset.core.node;

import io.consensusset.core.consensus.ConsensusSet;
import io.consensusset.core.consensus.PeerPenalizer;
import io.consensusset.core.consensus.StandardTransactionValidator;
import io.consensusset.core.protocol.Block;
import io.consensusset.core.state.ConsistencyFault;
import io.consensusset.core.storage.ChainStore;
import io.consensusset.core.storage.InMemoryChainStore;
import io.consensusset.core.storage.RocksDBChainStore;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires storage, the transaction validator and the consensus set.
 * Call start() once; it replays a stored chain or applies genesis.
 */
public final class Node implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final ChainStore chain;
    private final NodeConfig config;
    private final PeerPenalizer penalizer;
    private ConsensusSet consensus;

    public Node(ChainStore chain, NodeConfig config, PeerPenalizer penalizer) {
        this.chain = chain;
        this.config = config;
        this.penalizer = penalizer;
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(NodeConfig config) {
        return new Node(new InMemoryChainStore(), config, PeerPenalizer.logging());
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static Node rocks(NodeConfig config, String dataDir) {
        return new Node(RocksDBChainStore.open(dataDir), config, PeerPenalizer.logging());
    }

    /** Builds the consensus set. Safe to call multiple times. */
    public synchronized ConsensusSet start() throws ConsistencyFault {
        if (consensus == null) {
            Block genesis = GenesisBuilder.buildGenesis(config);
            consensus = new ConsensusSet(
                    genesis,
                    config.params,
                    new StandardTransactionValidator(config.params),
                    chain,
                    penalizer,
                    config.consistencyChecks
            );
        }
        return consensus;
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    @Override
    public synchronized void close() {
        try {
            if (consensus != null) {
                consensus.close();
            } else if (chain instanceof AutoCloseable) {
                ((AutoCloseable) chain).close();
            }
        } catch (Exception e) {
            LOG.log(Level.WARNING, "Failed to close chain store", e);
        }
    }

    public ChainStore chain() { return chain; }
    public NodeConfig config() { return config; }

    public synchronized ConsensusSet consensus() {
        if (consensus == null) throw new IllegalStateException("node not started");
        return consensus;
    }
}
