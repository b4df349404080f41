package io.consensusset.core.node;

import io.consensusset.core.protocol.Block;
import io.consensusset.core.protocol.BlockHeader;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundOutput;
import io.consensusset.core.protocol.Transaction;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Creates the genesis block.
 * - Height = 0
 * - parentId = zero hash
 * - one transaction carrying the initial siafund (and optional siacoin) allocations
 * - no miner payouts, difficulty = 0 (no PoW needed)
 * Allocations are emitted in unlock-hash order so every node derives the same id.
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    public static Block buildGenesis(NodeConfig config) {
        long siafunds = 0;
        Transaction.Builder tx = Transaction.builder();
        for (Map.Entry<String, Long> e : new TreeMap<>(config.genesisSiafundAllocations).entrySet()) {
            tx.siafundOutput(SiafundOutput.of(e.getValue(), Hash.fromHex(e.getKey())));
            siafunds += e.getValue();
        }
        for (Map.Entry<String, Long> e : new TreeMap<>(config.genesisSiacoinAllocations).entrySet()) {
            tx.siacoinOutput(SiacoinOutput.of(e.getValue(), Hash.fromHex(e.getKey())));
        }
        if (siafunds != config.params.siafundCount()) {
            throw new IllegalArgumentException("genesis allocates " + siafunds + " siafunds, expected "
                    + config.params.siafundCount());
        }

        List<Transaction> txs = List.of(tx.build());
        BlockHeader hdr = new BlockHeader(
                Hash.ZERO,                                  // parentId
                Block.computeMerkleRoot(List.of(), txs),
                0L,                                         // height
                config.genesisTimestamp,
                0L,                                         // difficultyBits
                0L                                          // nonce
        );
        return new Block(hdr, List.of(), txs);
    }
}
