package io.consensusset.core.protocol;

import java.nio.ByteBuffer;

public final class TransactionCodec {
    private TransactionCodec(){}

    public static Transaction fromBytes(byte[] bytes) {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        Transaction tx = read(buf);
        Encoding.requireFullyConsumed(buf, "transaction");
        return tx;
    }

    /** Reads one transaction in the order written by {@link Transaction#serialize()}. */
    public static Transaction read(ByteBuffer buf) {
        try {
            Transaction.Builder b = Transaction.builder();
            int n = Encoding.readCount(buf, ProtocolLimits.MAX_ELEMENTS_PER_LIST);
            for (int i = 0; i < n; i++) {
                b.siacoinInput(new SiacoinInput(Encoding.readHash(buf), Encoding.readHash(buf)));
            }
            for (SiacoinOutput o : Encoding.readList(buf, Encoding::readOutput)) b.siacoinOutput(o);
            for (FileContract fc : Encoding.readList(buf, Encoding::readContract)) b.fileContract(fc);
            n = Encoding.readCount(buf, ProtocolLimits.MAX_ELEMENTS_PER_LIST);
            for (int i = 0; i < n; i++) b.storageProof(new StorageProof(Encoding.readHash(buf)));
            n = Encoding.readCount(buf, ProtocolLimits.MAX_ELEMENTS_PER_LIST);
            for (int i = 0; i < n; i++) {
                b.siafundInput(new SiafundInput(Encoding.readHash(buf), Encoding.readHash(buf), Encoding.readHash(buf)));
            }
            for (SiafundOutput o : Encoding.readList(buf, Encoding::readFundOutput)) b.siafundOutput(o);
            n = Encoding.readCount(buf, ProtocolLimits.MAX_ELEMENTS_PER_LIST);
            for (int i = 0; i < n; i++) b.minerFee(Encoding.readCurrency(buf));
            return b.build();
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Transaction bytes", ex);
        }
    }
}
