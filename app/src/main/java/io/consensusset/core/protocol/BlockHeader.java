package io.consensusset.core.protocol;

import java.nio.ByteBuffer;

/**
 * Minimal header: everything needed to identify/verify a block without its body.
 * - parentId: link to previous block (zero for genesis)
 * - merkleRoot: commitment to miner payouts and transactions
 * - height: block number (genesis = 0)
 * - timestamp: producer clock in millis (sanity-checked by ConsensusRules)
 * - difficultyBits: required leading zero bits of the header hash
 * - nonce: PoW search space
 */
public final class BlockHeader {
    private final Hash parentId;
    private final Hash merkleRoot;
    private final long height;
    private final long timestamp;
    private final long difficultyBits;
    private final long nonce;

    public BlockHeader(Hash parentId,
                       Hash merkleRoot,
                       long height,
                       long timestamp,
                       long difficultyBits,
                       long nonce) {
        this.parentId = parentId != null ? parentId : Hash.ZERO;
        this.merkleRoot = merkleRoot != null ? merkleRoot : Hash.ZERO;
        this.height = height;
        this.timestamp = timestamp;
        this.difficultyBits = difficultyBits;
        this.nonce = nonce;
        basicValidate();
    }

    public Hash parentId() { return parentId; }
    public Hash merkleRoot() { return merkleRoot; }
    public long height() { return height; }
    public long timestamp() { return timestamp; }
    public long difficultyBits() { return difficultyBits; }
    public long nonce() { return nonce; }

    public static final int ENCODED_LENGTH = Hash.LENGTH * 2 + 8 * 4;

    // Deterministic header bytes
    public byte[] serialize() {
        ByteBuffer buf = ByteBuffer.allocate(ENCODED_LENGTH);
        buf.put(parentId.bytes());
        buf.put(merkleRoot.bytes());
        buf.putLong(height);
        buf.putLong(timestamp);
        buf.putLong(difficultyBits);
        buf.putLong(nonce);
        return buf.array();
    }

    public static BlockHeader read(ByteBuffer buf) {
        Hash parent = Encoding.readHash(buf);
        Hash merkle = Encoding.readHash(buf);
        long height = buf.getLong();
        long ts = buf.getLong();
        long bits = buf.getLong();
        long nonce = buf.getLong();
        return new BlockHeader(parent, merkle, height, ts, bits, nonce);
    }

    /** Block id = SHA-256 of the header bytes. */
    public Hash id() {
        return Hashes.hash(serialize());
    }

    public void basicValidate() {
        if (height < 0) throw new IllegalArgumentException("height must be >= 0");
        if (timestamp <= 0) throw new IllegalArgumentException("timestamp must be > 0");
    }

    @Override public String toString() {
        return "BlockHeader{h=" + height + ", ts=" + timestamp + "}";
    }
}
