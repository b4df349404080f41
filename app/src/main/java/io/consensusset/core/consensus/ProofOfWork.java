package io.consensusset.core.consensus;

import io.consensusset.core.protocol.BlockHeader;

import java.math.BigInteger;

/**
 * Minimal Proof-of-Work:
 * - Interprets header.difficultyBits as "required leading zero BITS" in the block id.
 * - Block id = SHA-256(header.serialize()).
 *
 * Example:
 *   difficultyBits = 16  -> id must start with at least 16 zero bits (two 0x00 bytes).
 */
public final class ProofOfWork {

    private ProofOfWork() {}

    /** Quick check: does this header meet its difficulty requirement? */
    public static boolean meetsTarget(BlockHeader header) {
        int requiredBits = toRequiredBits(header.difficultyBits());
        return hasLeadingZeroBits(header.id().bytes(), requiredBits);
    }

    /**
     * Work contributed by one block: 2^difficultyBits. Fork choice compares the sum
     * of this over each branch.
     */
    public static BigInteger calculateBlockWork(BlockHeader header) {
        if (header == null) {
            return BigInteger.ZERO;
        }
        int requiredBits = toRequiredBits(header.difficultyBits());
        if (requiredBits <= 0) {
            return BigInteger.ONE;
        }
        return BigInteger.ONE.shiftLeft(requiredBits);
    }

    // ---------- helpers ----------

    /** Clamp difficulty to a sane non-negative int. */
    private static int toRequiredBits(long difficultyBits) {
        if (difficultyBits < 0) return 0;
        if (difficultyBits > 256) return 256; // SHA-256 cap
        return (int) difficultyBits;
    }

    /**
     * Check for N leading zero bits in the hash.
     * Fast path: count whole zero bytes, then the first non-zero byte's leading zeros.
     */
    private static boolean hasLeadingZeroBits(byte[] hash, int requiredBits) {
        if (requiredBits <= 0) return true;

        int fullBytes = requiredBits / 8;
        int remBits = requiredBits % 8;

        // All required full bytes must be 0x00
        for (int i = 0; i < fullBytes; i++) {
            if (hash[i] != 0) return false;
        }
        if (remBits == 0) return true;

        // Check leading bits in the next byte
        int next = hash[fullBytes] & 0xff;
        return Integer.numberOfLeadingZeros(next) - 24 >= remBits;
    }
}
