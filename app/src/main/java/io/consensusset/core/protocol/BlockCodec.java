package io.consensusset.core.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

public final class BlockCodec {
    private BlockCodec(){}

    public static Block fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length > ProtocolLimits.MAX_BLOCK_BYTES) {
            throw new IllegalArgumentException("Malformed Block bytes");
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            BlockHeader header = BlockHeader.read(buf);
            List<SiacoinOutput> payouts = Encoding.readList(buf, Encoding::readOutput);

            int count = Encoding.readCount(buf, ProtocolLimits.MAX_TXS_PER_BLOCK);
            List<Transaction> txs = new ArrayList<Transaction>(count);
            for (int i = 0; i < count; i++) {
                txs.add(TransactionCodec.fromBytes(Encoding.readBytes(buf)));
            }
            Encoding.requireFullyConsumed(buf, "block");
            return new Block(header, payouts, txs);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Block bytes", ex);
        }
    }
}
