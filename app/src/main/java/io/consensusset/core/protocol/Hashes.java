package io.consensusset.core.protocol;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    public static Hash hash(byte[] in) {
        return new Hash(sha256(in));
    }

    /**
     * Derives a child identifier: SHA-256(specifier || parent || index).
     * Output, contract and payout ids are all derived this way.
     */
    public static Hash derive(Specifier specifier, Hash parent, long index) {
        ByteBuffer buf = ByteBuffer.allocate(Specifier.LENGTH + Hash.LENGTH + 8);
        buf.put(specifier.bytes());
        buf.put(parent.bytes());
        buf.putLong(index);
        return hash(buf.array());
    }
}
