package io.consensusset.core.consensus;

import io.consensusset.core.protocol.Block;
import io.consensusset.core.protocol.BlockHeader;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundOutput;
import io.consensusset.core.protocol.Transaction;
import io.consensusset.core.state.ConsistencyFault;
import io.consensusset.core.storage.ChainStore;
import io.consensusset.core.storage.InMemoryChainStore;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/** Builds small valid chains: short maturity delay, 100 siafunds, zero difficulty. */
final class TestChain {
    static final Hash MINER = Hash.ofTag(0x4d);
    static final Hash FUND_HOLDER = Hash.ofTag(0x46);
    static final Hash COIN_HOLDER = Hash.ofTag(0x43);
    static final long GENESIS_COINS = 10_000L;
    static final long T0 = 1_700_000_000_000L;

    static final ConsensusParams PARAMS = new ConsensusParams(3L, 1_000L, 100L, 100L, 39L, 1_000L, 60_000L);

    static final Block GENESIS = genesis();

    private TestChain() {}

    private static Block genesis() {
        Transaction tx = Transaction.builder()
                .siafundOutput(SiafundOutput.of(100L, FUND_HOLDER))
                .siacoinOutput(SiacoinOutput.of(GENESIS_COINS, COIN_HOLDER))
                .build();
        List<Transaction> txs = List.of(tx);
        BlockHeader hdr = new BlockHeader(Hash.ZERO, Block.computeMerkleRoot(List.of(), txs), 0L, T0, 0L, 0L);
        return new Block(hdr, List.of(), txs);
    }

    /** Id of the genesis siacoin allocation. */
    static Hash genesisCoinId() {
        return GENESIS.transactions().get(0).siacoinOutputId(0);
    }

    static Hash genesisSiafundId() {
        return GENESIS.transactions().get(0).siafundOutputId(0);
    }

    static ConsensusSet newConsensusSet() throws ConsistencyFault {
        return newConsensusSet(new InMemoryChainStore(), PeerPenalizer.logging());
    }

    static ConsensusSet newConsensusSet(ChainStore store, PeerPenalizer penalizer) throws ConsistencyFault {
        return new ConsensusSet(GENESIS, PARAMS, new StandardTransactionValidator(PARAMS), store, penalizer, true);
    }

    /** Child of {@code parent} paying the exact subsidy plus fees to {@link #MINER}. */
    static Block child(Block parent, long salt, Transaction... txs) {
        return mine(parent, salt, 0L, txs);
    }

    /**
     * Child with a proof-of-work requirement; the nonce is searched until the header
     * meets {@code difficultyBits}.
     */
    static Block mine(Block parent, long salt, long difficultyBits, Transaction... txs) {
        long height = parent.header().height() + 1;
        List<Transaction> list = List.of(txs);
        BigInteger fees = BigInteger.ZERO;
        for (Transaction tx : list) fees = fees.add(tx.totalMinerFees());
        List<SiacoinOutput> payouts = new ArrayList<>();
        payouts.add(new SiacoinOutput(PARAMS.blockSubsidy(height).add(fees), MINER));
        return assemble(parent, height, salt, difficultyBits, payouts, list);
    }

    static Block withPayouts(Block parent, List<SiacoinOutput> payouts, Transaction... txs) {
        return assemble(parent, parent.header().height() + 1, 0L, 0L, payouts, List.of(txs));
    }

    private static Block assemble(Block parent, long height, long salt, long difficultyBits,
                                  List<SiacoinOutput> payouts, List<Transaction> txs) {
        Hash root = Block.computeMerkleRoot(payouts, txs);
        long timestamp = parent.header().timestamp() + 1_000L + salt;
        for (long nonce = 0; ; nonce++) {
            BlockHeader hdr = new BlockHeader(parent.id(), root, height, timestamp, difficultyBits, nonce);
            if (ProofOfWork.meetsTarget(hdr)) {
                return new Block(hdr, payouts, txs);
            }
        }
    }

    /** Chain of empty blocks on top of {@code parent}. */
    static List<Block> extend(Block parent, int count, long salt) {
        List<Block> out = new ArrayList<>();
        Block prev = parent;
        for (int i = 0; i < count; i++) {
            prev = child(prev, salt);
            out.add(prev);
        }
        return out;
    }
}
