package io.consensusset.core.state;

import io.consensusset.core.protocol.FileContract;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundOutput;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory consensus ledger: coin, fund and contract registries, the maturity queue,
 * the siafund pool and the current height. Created empty; registries change only
 * through {@link DiffCommitEngine}. Not thread-safe; the owner provides locking.
 */
public final class LedgerState implements LedgerView {

    private final LedgerRegistry<SiacoinOutput> siacoinOutputs = new LedgerRegistry<>();
    private final LedgerRegistry<SiafundOutput> siafundOutputs = new LedgerRegistry<>();
    private final LedgerRegistry<FileContract> fileContracts = new LedgerRegistry<>();
    private final MaturityQueue maturityQueue = new MaturityQueue();

    private final LedgerView readOnlyView = new ReadOnlyView();

    private BigInteger siafundPool = BigInteger.ZERO;
    private long height = -1L;

    @Override
    public long height() {
        return height;
    }

    void setHeight(long height) {
        if (height < -1L) throw new IllegalArgumentException("height must be >= -1");
        this.height = height;
    }

    @Override
    public Optional<SiacoinOutput> getSiacoinOutput(Hash id) {
        return siacoinOutputs.get(id);
    }

    @Override
    public Optional<SiafundOutput> getSiafundOutput(Hash id) {
        return siafundOutputs.get(id);
    }

    @Override
    public Optional<FileContract> getFileContract(Hash id) {
        return fileContracts.get(id);
    }

    @Override
    public Map<Hash, SiacoinOutput> getDelayedSiacoinOutputs(long maturityHeight) {
        return maturityQueue.outputsAt(maturityHeight);
    }

    @Override
    public BigInteger siafundPool() {
        return siafundPool;
    }

    @Override
    public Map<Hash, FileContract> fileContracts() {
        return fileContracts.snapshot();
    }

    public Map<Hash, SiafundOutput> siafundOutputs() {
        return siafundOutputs.snapshot();
    }

    public MaturityQueue maturityQueue() {
        return maturityQueue;
    }

    /** View over this ledger that cannot be cast back to a mutable type. */
    public LedgerView readOnlyView() {
        return readOnlyView;
    }

    @Override
    public LedgerSnapshot snapshot() {
        return new LedgerSnapshot(
                height,
                siacoinOutputs.snapshot(),
                siafundOutputs.snapshot(),
                fileContracts.snapshot(),
                maturityQueue.snapshot(),
                siafundPool
        );
    }

    // package-private accessors for the commit engine

    LedgerRegistry<SiacoinOutput> siacoinRegistry() { return siacoinOutputs; }
    LedgerRegistry<SiafundOutput> siafundRegistry() { return siafundOutputs; }
    LedgerRegistry<FileContract> contractRegistry() { return fileContracts; }

    void setSiafundPool(BigInteger pool) {
        this.siafundPool = pool;
    }

    private final class ReadOnlyView implements LedgerView {
        @Override
        public long height() {
            return height;
        }

        @Override
        public Optional<SiacoinOutput> getSiacoinOutput(Hash id) {
            return LedgerState.this.getSiacoinOutput(id);
        }

        @Override
        public Optional<SiafundOutput> getSiafundOutput(Hash id) {
            return LedgerState.this.getSiafundOutput(id);
        }

        @Override
        public Optional<FileContract> getFileContract(Hash id) {
            return LedgerState.this.getFileContract(id);
        }

        @Override
        public Map<Hash, SiacoinOutput> getDelayedSiacoinOutputs(long maturityHeight) {
            return LedgerState.this.getDelayedSiacoinOutputs(maturityHeight);
        }

        @Override
        public BigInteger siafundPool() {
            return siafundPool;
        }

        @Override
        public Map<Hash, FileContract> fileContracts() {
            return LedgerState.this.fileContracts();
        }

        @Override
        public LedgerSnapshot snapshot() {
            return LedgerState.this.snapshot();
        }
    }
}
