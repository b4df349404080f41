package io.consensusset.core.protocol;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Deterministic binary encoding shared by blocks, transactions and diffs.
 * Integers are big-endian, currencies are length-prefixed unsigned magnitudes with
 * no leading zero byte, lists are count-prefixed. Every value has exactly one encoding.
 */
public final class Encoding {
    private Encoding() {}

    public static final class Writer {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private final ByteBuffer scratch = ByteBuffer.allocate(8);

        public Writer writeByte(int v) {
            out.write(v);
            return this;
        }

        public Writer writeInt(int v) {
            scratch.clear();
            scratch.putInt(v);
            out.write(scratch.array(), 0, 4);
            return this;
        }

        public Writer writeLong(long v) {
            scratch.clear();
            scratch.putLong(v);
            out.write(scratch.array(), 0, 8);
            return this;
        }

        public Writer writeHash(Hash h) {
            out.writeBytes(h.bytes());
            return this;
        }

        public Writer writeCurrency(BigInteger v) {
            if (v.signum() < 0) throw new IllegalArgumentException("negative currency");
            byte[] raw = v.toByteArray();
            int off = (raw.length > 1 && raw[0] == 0) ? 1 : 0;
            if (v.signum() == 0) {
                writeInt(0);
                return this;
            }
            writeInt(raw.length - off);
            out.write(raw, off, raw.length - off);
            return this;
        }

        public Writer writeRaw(byte[] b) {
            out.writeBytes(b);
            return this;
        }

        public Writer writeBytes(byte[] b) {
            writeInt(b.length);
            out.writeBytes(b);
            return this;
        }

        public Writer writeOutput(SiacoinOutput o) {
            writeCurrency(o.value());
            writeHash(o.unlockHash());
            return this;
        }

        public Writer writeOutputs(List<SiacoinOutput> outputs) {
            writeInt(outputs.size());
            for (SiacoinOutput o : outputs) writeOutput(o);
            return this;
        }

        public Writer writeFundOutput(SiafundOutput o) {
            writeCurrency(o.value());
            writeHash(o.unlockHash());
            writeCurrency(o.claimStart());
            return this;
        }

        public Writer writeContract(FileContract fc) {
            writeLong(fc.fileSize());
            writeHash(fc.fileMerkleRoot());
            writeLong(fc.windowStart());
            writeLong(fc.windowEnd());
            writeCurrency(fc.payout());
            writeOutputs(fc.validProofOutputs());
            writeOutputs(fc.missedProofOutputs());
            writeHash(fc.unlockHash());
            writeLong(fc.revisionNumber());
            return this;
        }

        public byte[] toByteArray() {
            return out.toByteArray();
        }
    }

    public static Hash readHash(ByteBuffer b) {
        byte[] raw = new byte[Hash.LENGTH];
        b.get(raw);
        return new Hash(raw);
    }

    public static BigInteger readCurrency(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > ProtocolLimits.MAX_CURRENCY_BYTES || len > b.remaining()) {
            throw new IllegalArgumentException("Bad currency length: " + len);
        }
        if (len == 0) return BigInteger.ZERO;
        byte[] raw = new byte[len];
        b.get(raw);
        if (raw[0] == 0) throw new IllegalArgumentException("Non-canonical currency encoding");
        return new BigInteger(1, raw);
    }

    public static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + b.remaining() + ")");
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    public static int readCount(ByteBuffer b, int max) {
        int n = b.getInt();
        if (n < 0 || n > max) throw new IllegalArgumentException("bad element count: " + n);
        return n;
    }

    public static <T> List<T> readList(ByteBuffer b, Function<ByteBuffer, T> reader) {
        int n = readCount(b, ProtocolLimits.MAX_ELEMENTS_PER_LIST);
        List<T> out = new ArrayList<>(Math.min(n, 1024));
        for (int i = 0; i < n; i++) out.add(reader.apply(b));
        return out;
    }

    public static SiacoinOutput readOutput(ByteBuffer b) {
        BigInteger value = readCurrency(b);
        Hash unlock = readHash(b);
        return new SiacoinOutput(value, unlock);
    }

    public static SiafundOutput readFundOutput(ByteBuffer b) {
        BigInteger value = readCurrency(b);
        Hash unlock = readHash(b);
        BigInteger claimStart = readCurrency(b);
        return new SiafundOutput(value, unlock, claimStart);
    }

    public static FileContract readContract(ByteBuffer b) {
        long fileSize = b.getLong();
        Hash root = readHash(b);
        long windowStart = b.getLong();
        long windowEnd = b.getLong();
        BigInteger payout = readCurrency(b);
        List<SiacoinOutput> valid = readList(b, Encoding::readOutput);
        List<SiacoinOutput> missed = readList(b, Encoding::readOutput);
        Hash unlock = readHash(b);
        long revision = b.getLong();
        return new FileContract(fileSize, root, windowStart, windowEnd, payout, valid, missed, unlock, revision);
    }

    /** Throws if the buffer still holds bytes after a full decode. */
    public static void requireFullyConsumed(ByteBuffer b, String what) {
        if (b.hasRemaining()) {
            throw new IllegalArgumentException("Trailing bytes after " + what + ": " + b.remaining());
        }
    }
}
