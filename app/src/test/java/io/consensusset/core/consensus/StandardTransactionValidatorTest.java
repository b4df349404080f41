package io.consensusset.core.consensus;

import io.consensusset.core.diff.DiffDirection;
import io.consensusset.core.diff.SiacoinOutputDiff;
import io.consensusset.core.diff.SiafundOutputDiff;
import io.consensusset.core.protocol.FileContract;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinInput;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundInput;
import io.consensusset.core.protocol.SiafundOutput;
import io.consensusset.core.protocol.StorageProof;
import io.consensusset.core.protocol.Transaction;
import io.consensusset.core.state.DiffCommitEngine;
import io.consensusset.core.state.LedgerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static io.consensusset.core.consensus.BlockRejectedException.Reason.DOS_BLOCK;
import static io.consensusset.core.consensus.BlockRejectedException.Reason.INVALID_TRANSACTION;
import static org.junit.jupiter.api.Assertions.*;

class StandardTransactionValidatorTest {

    private static final Hash OWNER = Hash.ofTag(0x01);
    private static final Hash COIN = Hash.ofTag(0x10);
    private static final Hash FUND = Hash.ofTag(0x20);

    private final StandardTransactionValidator validator = new StandardTransactionValidator(TestChain.PARAMS);
    private LedgerState ledger;

    @BeforeEach
    void setUp() throws Exception {
        ledger = new LedgerState();
        DiffCommitEngine engine = new DiffCommitEngine(ledger);
        engine.commit(new SiacoinOutputDiff(DiffDirection.APPLY, COIN, SiacoinOutput.of(1_000L, OWNER)), DiffDirection.APPLY);
        engine.commit(new SiafundOutputDiff(DiffDirection.APPLY, FUND, SiafundOutput.of(100L, OWNER)), DiffDirection.APPLY);
        engine.setHeight(9L);
    }

    @Test
    void acceptsBalancedSpend() {
        Transaction tx = spend().siacoinOutput(SiacoinOutput.of(990L, OWNER)).minerFee(10L).build();
        assertDoesNotThrow(() -> validator.validate(tx, ledger, 10L));
    }

    @Test
    void rejectsWrongUnlockHash() {
        Transaction tx = Transaction.builder()
                .siacoinInput(new SiacoinInput(COIN, Hash.ofTag(0x02)))
                .siacoinOutput(SiacoinOutput.of(1_000L, OWNER))
                .build();
        assertReason(tx, INVALID_TRANSACTION);
    }

    @Test
    void rejectsSameInputTwice() {
        Transaction tx = spend()
                .siacoinInput(new SiacoinInput(COIN, OWNER))
                .siacoinOutput(SiacoinOutput.of(2_000L, OWNER))
                .build();
        assertReason(tx, INVALID_TRANSACTION);
    }

    @Test
    void rejectsCreatingMoreThanSpent() {
        Transaction tx = spend().siacoinOutput(SiacoinOutput.of(1_001L, OWNER)).build();
        assertReason(tx, INVALID_TRANSACTION);
    }

    @Test
    void flagsFundedButUnspentValueAsDos() {
        Transaction tx = spend().siacoinOutput(SiacoinOutput.of(400L, OWNER)).build();
        assertReason(tx, DOS_BLOCK);
    }

    @Test
    void rejectsContractOutputsThatIgnoreTax() {
        FileContract fc = new FileContract(0L, Hash.ZERO, 11L, 20L, BigInteger.valueOf(1_000L),
                List.of(SiacoinOutput.of(1_000L, OWNER)), List.of(SiacoinOutput.of(1_000L, OWNER)), OWNER, 0L);
        Transaction tx = spend().fileContract(fc).build();
        assertReason(tx, INVALID_TRANSACTION);
    }

    @Test
    void rejectsContractWindowInThePast() {
        FileContract fc = new FileContract(0L, Hash.ZERO, 10L, 20L, BigInteger.valueOf(1_000L),
                List.of(SiacoinOutput.of(961L, OWNER)), List.of(SiacoinOutput.of(961L, OWNER)), OWNER, 0L);
        Transaction tx = spend().fileContract(fc).build();
        assertReason(tx, INVALID_TRANSACTION);
    }

    @Test
    void rejectsProofForUnknownContract() {
        Transaction tx = Transaction.builder().storageProof(new StorageProof(Hash.ofTag(0x33))).build();
        assertReason(tx, INVALID_TRANSACTION);
    }

    @Test
    void siafundsMustBalance() {
        Transaction ok = Transaction.builder()
                .siafundInput(new SiafundInput(FUND, OWNER, OWNER))
                .siafundOutput(SiafundOutput.of(60L, OWNER))
                .siafundOutput(SiafundOutput.of(40L, Hash.ofTag(0x03)))
                .build();
        assertDoesNotThrow(() -> validator.validate(ok, ledger, 10L));

        Transaction minted = Transaction.builder().siafundOutput(SiafundOutput.of(1L, OWNER)).build();
        assertReason(minted, INVALID_TRANSACTION);
    }

    private static Transaction.Builder spend() {
        return Transaction.builder().siacoinInput(new SiacoinInput(COIN, OWNER));
    }

    private void assertReason(Transaction tx, BlockRejectedException.Reason reason) {
        BlockRejectedException e = assertThrows(BlockRejectedException.class, () -> validator.validate(tx, ledger, 10L));
        assertEquals(reason, e.reason());
    }
}
