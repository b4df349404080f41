package io.consensusset.core.state;

import io.consensusset.core.diff.DelayedSiacoinOutputDiff;
import io.consensusset.core.diff.FileContractDiff;
import io.consensusset.core.diff.SiafundOutputDiff;
import io.consensusset.core.protocol.FileContract;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundOutput;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static io.consensusset.core.diff.DiffDirection.APPLY;
import static org.junit.jupiter.api.Assertions.*;

class ConsistencyCheckerTest {

    private final ConsistencyChecker checker = new ConsistencyChecker(100);

    @Test
    void passesOnConsistentLedger() throws Exception {
        LedgerState state = ledgerWithSiafunds(100);
        state.setHeight(3);
        assertDoesNotThrow(() -> checker.check(state));
    }

    @Test
    void flagsUndrainedMaturityBucket() throws Exception {
        LedgerState state = ledgerWithSiafunds(100);
        new DiffCommitEngine(state).commit(
                new DelayedSiacoinOutputDiff(APPLY, Hash.ofTag(9), SiacoinOutput.of(1, Hash.ofTag(9)), 2), APPLY);
        state.setHeight(2);
        assertInvariantViolation(state);
    }

    @Test
    void flagsExpiredContract() throws Exception {
        LedgerState state = ledgerWithSiafunds(100);
        FileContract fc = new FileContract(0, Hash.ZERO, 1, 3, BigInteger.TEN, List.of(), List.of(), Hash.ZERO, 0);
        new DiffCommitEngine(state).commit(new FileContractDiff(APPLY, Hash.ofTag(5), fc), APPLY);
        state.setHeight(3);
        assertInvariantViolation(state);
    }

    @Test
    void flagsWrongSiafundTotal() throws Exception {
        LedgerState state = ledgerWithSiafunds(99);
        state.setHeight(0);
        assertInvariantViolation(state);
    }

    private static LedgerState ledgerWithSiafunds(long amount) throws ConsistencyFault {
        LedgerState state = new LedgerState();
        new DiffCommitEngine(state).commit(
                new SiafundOutputDiff(APPLY, Hash.ofTag(1), SiafundOutput.of(amount, Hash.ofTag(1))), APPLY);
        return state;
    }

    private void assertInvariantViolation(LedgerState state) {
        ConsistencyFault f = assertThrows(ConsistencyFault.class, () -> checker.check(state));
        assertEquals(ConsistencyFault.Kind.INVARIANT_VIOLATION, f.kind());
    }
}
