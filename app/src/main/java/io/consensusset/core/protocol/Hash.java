package io.consensusset.core.protocol;

import java.util.Arrays;

/**
 * 32-byte content-addressed identifier (block ids, output ids, contract ids, unlock hashes).
 * Ordered as unsigned bytes so ledger iteration is deterministic.
 */
public final class Hash implements Comparable<Hash> {
    public static final int LENGTH = 32;
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    /** Test/tooling helper: hash whose first byte is {@code tag}, rest zero. */
    public static Hash ofTag(int tag) {
        byte[] b = new byte[LENGTH];
        b[0] = (byte) tag;
        return new Hash(b);
    }

    /** Parses 64 hex characters, as printed by {@link #hex()}. */
    public static Hash fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Hash hex must be " + (LENGTH * 2) + " characters");
        }
        byte[] b = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            int hi = Character.digit(hex.charAt(2 * i), 16);
            int lo = Character.digit(hex.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) throw new IllegalArgumentException("Invalid hex in hash: " + hex);
            b[i] = (byte) ((hi << 4) | lo);
        }
        return new Hash(b);
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return toHex(bytes); }
    public boolean isZero() { return Arrays.equals(bytes, ZERO.bytes); }

    private static String toHex(byte[] b){
        final char[] HEX="0123456789abcdef".toCharArray();
        char[] out=new char[b.length*2];
        for(int i=0,j=0;i<b.length;i++){int v=b[i]&0xff;out[j++]=HEX[v>>>4];out[j++]=HEX[v&0x0f];}
        return new String(out);
    }

    @Override public int compareTo(Hash o) { return Arrays.compareUnsigned(bytes, o.bytes); }
    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Hash("+hex().substring(0,8)+"…)"; }
}
