package io.consensusset.core.state;

import io.consensusset.core.diff.DelayedSiacoinOutputDiff;
import io.consensusset.core.diff.DiffDirection;
import io.consensusset.core.diff.FileContractDiff;
import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.diff.SiacoinOutputDiff;
import io.consensusset.core.diff.SiafundOutputDiff;
import io.consensusset.core.diff.SiafundPoolDiff;
import io.consensusset.core.protocol.FileContract;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static io.consensusset.core.diff.DiffDirection.APPLY;
import static io.consensusset.core.diff.DiffDirection.REVERT;
import static org.junit.jupiter.api.Assertions.*;

class DiffCommitEngineTest {

    private static final Hash ID = Hash.ofTag(1);
    private static final Hash OWNER = Hash.ofTag(2);

    private LedgerState state;
    private DiffCommitEngine engine;

    @BeforeEach
    void setUp() {
        state = new LedgerState();
        engine = new DiffCommitEngine(state);
    }

    @Test
    void applyThenRevertLeavesRegistryEmpty() throws Exception {
        SiacoinOutputDiff d = new SiacoinOutputDiff(APPLY, ID, SiacoinOutput.of(10, OWNER));
        engine.commit(d, APPLY);
        assertEquals(SiacoinOutput.of(10, OWNER), state.getSiacoinOutput(ID).orElseThrow());

        engine.commit(d, REVERT);
        assertTrue(state.getSiacoinOutput(ID).isEmpty());
    }

    @Test
    void revertDirectionDiffRemovesOnApply() throws Exception {
        engine.commit(new SiacoinOutputDiff(APPLY, ID, SiacoinOutput.of(10, OWNER)), APPLY);
        engine.commit(new SiacoinOutputDiff(REVERT, ID, SiacoinOutput.of(10, OWNER)), APPLY);
        assertTrue(state.getSiacoinOutput(ID).isEmpty());
    }

    @Test
    void committingInverseEqualsCommittingOpposite() throws Exception {
        FileContract fc = FileContract.withPayout(5);
        FileContractDiff d = new FileContractDiff(APPLY, ID, fc);

        LedgerState other = new LedgerState();
        DiffCommitEngine otherEngine = new DiffCommitEngine(other);

        engine.commit(d, APPLY);
        otherEngine.commit(d, APPLY);
        engine.commit(d, REVERT);
        otherEngine.commit(d.inverse(), APPLY);

        assertEquals(state.snapshot(), other.snapshot());
        assertTrue(state.getFileContract(ID).isEmpty());
    }

    @Test
    void duplicateAddIsAFault() throws Exception {
        SiafundOutputDiff d = new SiafundOutputDiff(APPLY, ID, SiafundOutput.of(3, OWNER));
        engine.commit(d, APPLY);

        ConsistencyFault f = assertThrows(ConsistencyFault.class, () -> engine.commit(d, APPLY));
        assertEquals(ConsistencyFault.Kind.DUPLICATE_ENTITY, f.kind());
        assertSame(d, f.diff());
    }

    @Test
    void removingAbsentEntityIsAFault() {
        SiacoinOutputDiff d = new SiacoinOutputDiff(APPLY, ID, SiacoinOutput.of(10, OWNER));
        ConsistencyFault f = assertThrows(ConsistencyFault.class, () -> engine.commit(d, REVERT));
        assertEquals(ConsistencyFault.Kind.MISSING_ENTITY, f.kind());
    }

    @Test
    void removingWithDifferentValueIsAFault() throws Exception {
        engine.commit(new SiacoinOutputDiff(APPLY, ID, SiacoinOutput.of(10, OWNER)), APPLY);

        SiacoinOutputDiff wrong = new SiacoinOutputDiff(APPLY, ID, SiacoinOutput.of(11, OWNER));
        ConsistencyFault f = assertThrows(ConsistencyFault.class, () -> engine.commit(wrong, REVERT));
        assertEquals(ConsistencyFault.Kind.VALUE_MISMATCH, f.kind());
        assertTrue(state.getSiacoinOutput(ID).isPresent());
    }

    @Test
    void delayedOutputMustMatureAfterCurrentHeight() throws Exception {
        state.setHeight(10);
        DelayedSiacoinOutputDiff atHeight = new DelayedSiacoinOutputDiff(APPLY, ID, SiacoinOutput.of(1, OWNER), 10);
        ConsistencyFault f = assertThrows(ConsistencyFault.class, () -> engine.commit(atHeight, APPLY));
        assertEquals(ConsistencyFault.Kind.BAD_MATURITY_HEIGHT, f.kind());

        DelayedSiacoinOutputDiff next = new DelayedSiacoinOutputDiff(APPLY, ID, SiacoinOutput.of(1, OWNER), 11);
        engine.commit(next, APPLY);
        assertTrue(state.maturityQueue().hasBucket(11));

        ConsistencyFault again = assertThrows(ConsistencyFault.class, () -> engine.commit(next, APPLY));
        assertEquals(ConsistencyFault.Kind.DUPLICATE_ENTITY, again.kind());
        assertEquals(1, state.getDelayedSiacoinOutputs(11).size());
    }

    @Test
    void siacoinDiffFollowsDirectionTimesCommitDirection() throws Exception {
        SiacoinOutput one = SiacoinOutput.of(1, OWNER);
        SiacoinOutputDiff add = new SiacoinOutputDiff(APPLY, ID, one);
        SiacoinOutputDiff remove = new SiacoinOutputDiff(REVERT, ID, one);

        engine.commit(add, APPLY);
        ConsistencyFault f = assertThrows(ConsistencyFault.class, () -> engine.commit(add, APPLY));
        assertEquals(ConsistencyFault.Kind.DUPLICATE_ENTITY, f.kind());

        engine.commit(remove, APPLY);
        assertTrue(state.getSiacoinOutput(ID).isEmpty());

        engine.commit(remove, REVERT);
        assertEquals(one, state.getSiacoinOutput(ID).orElseThrow());
    }

    @Test
    void maturityCheckPrecedesExistenceCheck() {
        state.setHeight(10);
        // nothing queued anywhere, yet the maturity height is what gets reported
        DelayedSiacoinOutputDiff stale = new DelayedSiacoinOutputDiff(APPLY, ID, SiacoinOutput.of(1, OWNER), 5);
        ConsistencyFault f = assertThrows(ConsistencyFault.class, () -> engine.commit(stale, REVERT));
        assertEquals(ConsistencyFault.Kind.BAD_MATURITY_HEIGHT, f.kind());
    }

    @Test
    void emptiedMaturityBucketIsDropped() throws Exception {
        DelayedSiacoinOutputDiff a = new DelayedSiacoinOutputDiff(APPLY, Hash.ofTag(7), SiacoinOutput.of(1, OWNER), 4);
        DelayedSiacoinOutputDiff b = new DelayedSiacoinOutputDiff(APPLY, Hash.ofTag(8), SiacoinOutput.of(2, OWNER), 4);
        engine.commit(a, APPLY);
        engine.commit(b, APPLY);
        assertEquals(2, state.getDelayedSiacoinOutputs(4).size());

        engine.commit(a, REVERT);
        assertTrue(state.maturityQueue().hasBucket(4));
        engine.commit(b, REVERT);
        assertFalse(state.maturityQueue().hasBucket(4));
        assertEquals(0, state.maturityQueue().bucketCount());
    }

    @Test
    void removingFromMissingBucketIsAFault() {
        DelayedSiacoinOutputDiff d = new DelayedSiacoinOutputDiff(APPLY, ID, SiacoinOutput.of(1, OWNER), 4);
        ConsistencyFault f = assertThrows(ConsistencyFault.class, () -> engine.commit(d, REVERT));
        assertEquals(ConsistencyFault.Kind.MISSING_ENTITY, f.kind());
    }

    @Test
    void poolDiffMovesBetweenValues() throws Exception {
        SiafundPoolDiff d = new SiafundPoolDiff(APPLY, BigInteger.ZERO, BigInteger.valueOf(39));
        engine.commit(d, APPLY);
        assertEquals(BigInteger.valueOf(39), state.siafundPool());

        ConsistencyFault f = assertThrows(ConsistencyFault.class, () -> engine.commit(d, APPLY));
        assertEquals(ConsistencyFault.Kind.POOL_MISMATCH, f.kind());

        engine.commit(d, REVERT);
        assertEquals(BigInteger.ZERO, state.siafundPool());
    }

    @Test
    void commitAllRevertsInReverseOrder() throws Exception {
        // the second diff spends what the first created, so order matters both ways
        SiacoinOutput out = SiacoinOutput.of(10, OWNER);
        List<LedgerDiff> diffs = List.of(
                new SiacoinOutputDiff(APPLY, ID, out),
                new SiacoinOutputDiff(REVERT, ID, out),
                new SiacoinOutputDiff(APPLY, Hash.ofTag(3), out));
        LedgerSnapshot empty = state.snapshot();

        engine.commitAll(diffs, APPLY);
        assertTrue(state.getSiacoinOutput(ID).isEmpty());
        assertTrue(state.getSiacoinOutput(Hash.ofTag(3)).isPresent());

        engine.commitAll(diffs, DiffDirection.REVERT);
        assertEquals(empty, state.snapshot());
    }
}
