package io.consensusset.core.diff;

import io.consensusset.core.protocol.Encoding;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.ProtocolLimits;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary codec for persisted diff lists. Layout per diff: kind tag (1 byte),
 * direction (1 byte), then the kind's fields in declaration order. Decoding an
 * encoded list yields diffs equal to the originals and re-encodes to the same bytes.
 */
public final class DiffCodec {
    private DiffCodec() {}

    private static final int TAG_SIACOIN_OUTPUT = 1;
    private static final int TAG_SIAFUND_OUTPUT = 2;
    private static final int TAG_FILE_CONTRACT = 3;
    private static final int TAG_DELAYED_OUTPUT = 4;
    private static final int TAG_SIAFUND_POOL = 5;

    public static byte[] encodeList(List<LedgerDiff> diffs) {
        Encoding.Writer w = new Encoding.Writer();
        w.writeInt(diffs.size());
        for (LedgerDiff diff : diffs) {
            write(w, diff);
        }
        return w.toByteArray();
    }

    public static List<LedgerDiff> decodeList(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            int n = Encoding.readCount(buf, ProtocolLimits.MAX_ELEMENTS_PER_LIST);
            List<LedgerDiff> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                out.add(read(buf));
            }
            Encoding.requireFullyConsumed(buf, "diff list");
            return out;
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed diff list bytes", ex);
        }
    }

    private static void write(Encoding.Writer w, LedgerDiff diff) {
        diff.accept(new LedgerDiff.Visitor<Void>() {
            @Override
            public Void visit(SiacoinOutputDiff d) {
                header(w, TAG_SIACOIN_OUTPUT, d.direction());
                w.writeHash(d.id()).writeOutput(d.output());
                return null;
            }

            @Override
            public Void visit(SiafundOutputDiff d) {
                header(w, TAG_SIAFUND_OUTPUT, d.direction());
                w.writeHash(d.id()).writeFundOutput(d.output());
                return null;
            }

            @Override
            public Void visit(FileContractDiff d) {
                header(w, TAG_FILE_CONTRACT, d.direction());
                w.writeHash(d.id()).writeContract(d.contract());
                return null;
            }

            @Override
            public Void visit(DelayedSiacoinOutputDiff d) {
                header(w, TAG_DELAYED_OUTPUT, d.direction());
                w.writeHash(d.id()).writeOutput(d.output()).writeLong(d.maturityHeight());
                return null;
            }

            @Override
            public Void visit(SiafundPoolDiff d) {
                header(w, TAG_SIAFUND_POOL, d.direction());
                w.writeCurrency(d.previous()).writeCurrency(d.adjusted());
                return null;
            }
        });
    }

    private static void header(Encoding.Writer w, int tag, DiffDirection direction) {
        w.writeByte(tag);
        w.writeByte(direction == DiffDirection.APPLY ? 0 : 1);
    }

    private static LedgerDiff read(ByteBuffer buf) {
        int tag = buf.get() & 0xff;
        DiffDirection direction = readDirection(buf);
        switch (tag) {
            case TAG_SIACOIN_OUTPUT: {
                Hash id = Encoding.readHash(buf);
                return new SiacoinOutputDiff(direction, id, Encoding.readOutput(buf));
            }
            case TAG_SIAFUND_OUTPUT: {
                Hash id = Encoding.readHash(buf);
                return new SiafundOutputDiff(direction, id, Encoding.readFundOutput(buf));
            }
            case TAG_FILE_CONTRACT: {
                Hash id = Encoding.readHash(buf);
                return new FileContractDiff(direction, id, Encoding.readContract(buf));
            }
            case TAG_DELAYED_OUTPUT: {
                Hash id = Encoding.readHash(buf);
                return new DelayedSiacoinOutputDiff(direction, id, Encoding.readOutput(buf), buf.getLong());
            }
            case TAG_SIAFUND_POOL: {
                BigInteger previous = Encoding.readCurrency(buf);
                return new SiafundPoolDiff(direction, previous, Encoding.readCurrency(buf));
            }
            default:
                throw new IllegalArgumentException("unknown diff tag: " + tag);
        }
    }

    private static DiffDirection readDirection(ByteBuffer buf) {
        int raw = buf.get() & 0xff;
        if (raw == 0) return DiffDirection.APPLY;
        if (raw == 1) return DiffDirection.REVERT;
        throw new IllegalArgumentException("bad direction byte: " + raw);
    }
}
