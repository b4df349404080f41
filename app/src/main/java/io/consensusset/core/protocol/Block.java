package io.consensusset.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Block = header + miner payouts + transactions.
 * Body encoding: header bytes, then payouts, then N, then each tx.
 */
public final class Block {
    private final BlockHeader header;
    private final List<SiacoinOutput> minerPayouts;
    private final List<Transaction> transactions;
    private final Hash id;

    public Block(BlockHeader header, List<SiacoinOutput> minerPayouts, List<Transaction> txs) {
        this.header = header;
        this.minerPayouts = minerPayouts != null ? List.copyOf(minerPayouts) : List.of();
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        basicValidate();
        this.id = header.id();
    }

    public BlockHeader header() { return header; }
    public List<SiacoinOutput> minerPayouts() { return minerPayouts; }
    public List<Transaction> transactions() { return transactions; }
    public Hash id() { return id; }
    public Hash parentId() { return header.parentId(); }

    public Hash minerPayoutId(int index) {
        return Hashes.derive(Specifier.MINER_PAYOUT, id, index);
    }

    /** Deterministic encoding: header || payouts || count || tx[i]. */
    public byte[] serialize() {
        Encoding.Writer w = new Encoding.Writer();
        w.writeRaw(header.serialize());
        w.writeOutputs(minerPayouts);
        w.writeInt(transactions.size());
        for (Transaction tx : transactions) {
            w.writeBytes(tx.serialize());
        }
        return w.toByteArray();
    }

    /**
     * Merkle root over the hashes of the encoded miner payouts followed by the
     * transaction ids; the header commits to both.
     */
    public static Hash computeMerkleRoot(List<SiacoinOutput> payouts, List<Transaction> txs) {
        List<byte[]> leaves = new ArrayList<>(payouts.size() + txs.size());
        for (SiacoinOutput payout : payouts) {
            leaves.add(Hashes.sha256(new Encoding.Writer().writeOutput(payout).toByteArray()));
        }
        for (Transaction tx : txs) leaves.add(tx.id().bytes());
        return new Hash(Merkle.rootOf(leaves));
    }

    public Hash computeMerkleRoot() {
        return computeMerkleRoot(minerPayouts, transactions);
    }

    public void basicValidate() {
        if (header == null) throw new IllegalArgumentException("missing header");
        if (transactions.size() > ProtocolLimits.MAX_TXS_PER_BLOCK) throw new IllegalArgumentException("too many txs");
    }

    @Override public boolean equals(Object o) { return o instanceof Block && id.equals(((Block) o).id); }
    @Override public int hashCode() { return id.hashCode(); }

    @Override public String toString() {
        return "Block{height=" + header.height() + ", txs=" + transactions.size() + "}";
    }
}
