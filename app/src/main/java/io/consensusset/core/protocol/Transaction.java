package io.consensusset.core.protocol;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * UTXO-style transaction. Every field is an ordered list; the order fixes the derived
 * ids of created outputs and contracts and therefore the order of the diffs they produce.
 */
public final class Transaction {

    private final List<SiacoinInput> siacoinInputs;
    private final List<SiacoinOutput> siacoinOutputs;
    private final List<FileContract> fileContracts;
    private final List<StorageProof> storageProofs;
    private final List<SiafundInput> siafundInputs;
    private final List<SiafundOutput> siafundOutputs;
    private final List<BigInteger> minerFees;

    private final Hash id;

    private Transaction(Builder b) {
        this.siacoinInputs = List.copyOf(b.siacoinInputs);
        this.siacoinOutputs = List.copyOf(b.siacoinOutputs);
        this.fileContracts = List.copyOf(b.fileContracts);
        this.storageProofs = List.copyOf(b.storageProofs);
        this.siafundInputs = List.copyOf(b.siafundInputs);
        this.siafundOutputs = List.copyOf(b.siafundOutputs);
        this.minerFees = List.copyOf(b.minerFees);
        basicValidate();
        this.id = Hashes.hash(serialize());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final List<SiacoinInput> siacoinInputs = new ArrayList<>();
        private final List<SiacoinOutput> siacoinOutputs = new ArrayList<>();
        private final List<FileContract> fileContracts = new ArrayList<>();
        private final List<StorageProof> storageProofs = new ArrayList<>();
        private final List<SiafundInput> siafundInputs = new ArrayList<>();
        private final List<SiafundOutput> siafundOutputs = new ArrayList<>();
        private final List<BigInteger> minerFees = new ArrayList<>();

        public Builder siacoinInput(SiacoinInput in) { siacoinInputs.add(in); return this; }
        public Builder siacoinOutput(SiacoinOutput out) { siacoinOutputs.add(out); return this; }
        public Builder fileContract(FileContract fc) { fileContracts.add(fc); return this; }
        public Builder storageProof(StorageProof sp) { storageProofs.add(sp); return this; }
        public Builder siafundInput(SiafundInput in) { siafundInputs.add(in); return this; }
        public Builder siafundOutput(SiafundOutput out) { siafundOutputs.add(out); return this; }
        public Builder minerFee(BigInteger fee) { minerFees.add(fee); return this; }
        public Builder minerFee(long fee) { return minerFee(BigInteger.valueOf(fee)); }

        public Transaction build() { return new Transaction(this); }
    }

    public List<SiacoinInput> siacoinInputs() { return siacoinInputs; }
    public List<SiacoinOutput> siacoinOutputs() { return siacoinOutputs; }
    public List<FileContract> fileContracts() { return fileContracts; }
    public List<StorageProof> storageProofs() { return storageProofs; }
    public List<SiafundInput> siafundInputs() { return siafundInputs; }
    public List<SiafundOutput> siafundOutputs() { return siafundOutputs; }
    public List<BigInteger> minerFees() { return minerFees; }

    public Hash id() { return id; }

    public Hash siacoinOutputId(int index) { return Hashes.derive(Specifier.SIACOIN_OUTPUT, id, index); }
    public Hash siafundOutputId(int index) { return Hashes.derive(Specifier.SIAFUND_OUTPUT, id, index); }
    public Hash fileContractId(int index) { return Hashes.derive(Specifier.FILE_CONTRACT, id, index); }

    public BigInteger totalMinerFees() {
        BigInteger total = BigInteger.ZERO;
        for (BigInteger fee : minerFees) total = total.add(fee);
        return total;
    }

    public byte[] serialize() {
        Encoding.Writer w = new Encoding.Writer();
        w.writeInt(siacoinInputs.size());
        for (SiacoinInput in : siacoinInputs) {
            w.writeHash(in.parentId()).writeHash(in.unlockHash());
        }
        w.writeOutputs(siacoinOutputs);
        w.writeInt(fileContracts.size());
        for (FileContract fc : fileContracts) w.writeContract(fc);
        w.writeInt(storageProofs.size());
        for (StorageProof sp : storageProofs) w.writeHash(sp.parentId());
        w.writeInt(siafundInputs.size());
        for (SiafundInput in : siafundInputs) {
            w.writeHash(in.parentId()).writeHash(in.unlockHash()).writeHash(in.claimUnlockHash());
        }
        w.writeInt(siafundOutputs.size());
        for (SiafundOutput o : siafundOutputs) w.writeFundOutput(o);
        w.writeInt(minerFees.size());
        for (BigInteger fee : minerFees) w.writeCurrency(fee);
        return w.toByteArray();
    }

    private void basicValidate() {
        for (BigInteger fee : minerFees) {
            if (fee == null || fee.signum() < 0) throw new IllegalArgumentException("miner fee must be >= 0");
        }
    }

    @Override public boolean equals(Object o) { return o instanceof Transaction && id.equals(((Transaction) o).id); }
    @Override public int hashCode() { return id.hashCode(); }

    @Override public String toString() {
        return "Transaction{id=" + id + ", sci=" + siacoinInputs.size() + ", sco=" + siacoinOutputs.size()
                + ", fc=" + fileContracts.size() + ", sp=" + storageProofs.size() + "}";
    }
}
