package io.consensusset.core.storage;

import io.consensusset.core.diff.DelayedSiacoinOutputDiff;
import io.consensusset.core.diff.DiffDirection;
import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.diff.SiafundOutputDiff;
import io.consensusset.core.protocol.Block;
import io.consensusset.core.protocol.BlockHeader;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundOutput;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/** Behaviour every ChainStore must share. */
abstract class ChainStoreContract {

    abstract ChainStore store();

    static Block block(Block parent, long salt) {
        Hash parentId = parent == null ? Hash.ZERO : parent.id();
        long height = parent == null ? 0 : parent.header().height() + 1;
        List<SiacoinOutput> payouts = List.of(SiacoinOutput.of(100 + height, Hash.ofTag(7)));
        BlockHeader hdr = new BlockHeader(parentId, Block.computeMerkleRoot(payouts, List.of()), height,
                1_000L + height * 10 + salt, 0L, 0L);
        return new Block(hdr, payouts, List.of());
    }

    static PathEntry entry(Block b) {
        List<LedgerDiff> diffs = List.of(
                new DelayedSiacoinOutputDiff(DiffDirection.APPLY, b.minerPayoutId(0), b.minerPayouts().get(0),
                        b.header().height() + 3),
                new SiafundOutputDiff(DiffDirection.APPLY, Hash.ofTag((int) b.header().height() + 1),
                        SiafundOutput.of(1L, Hash.ofTag(1))));
        return new PathEntry(b, diffs);
    }

    @Test
    void emptyStoreHasNoPath() {
        assertTrue(store().getPath().isEmpty());
        assertTrue(store().getHead().isEmpty());
        assertEquals(0, store().size());
    }

    @Test
    void commitPathStoresBlocksDiffsAndPath() {
        ChainStore store = store();
        Block g = block(null, 0);
        Block b1 = block(g, 0);
        store.commitPath(-1, List.of(entry(g), entry(b1)));

        assertEquals(List.of(g.id(), b1.id()), store.getPath());
        assertEquals(b1.id(), store.getHead().orElseThrow());
        assertEquals(b1, store.getBlock(b1.id()).orElseThrow());
        assertArrayEquals(b1.serialize(), store.getBlock(b1.id()).orElseThrow().serialize());
        assertEquals(entry(b1).diffs(), store.getDiffs(b1.id()).orElseThrow());
        assertEquals(2, store.size());
    }

    @Test
    void commitPathTruncatesAtForkHeight() {
        ChainStore store = store();
        Block g = block(null, 0);
        Block b1 = block(g, 0);
        Block b2 = block(b1, 0);
        Block c1 = block(g, 5);
        store.commitPath(-1, List.of(entry(g), entry(b1), entry(b2)));

        store.commitPath(0, List.of(entry(c1)));

        assertEquals(List.of(g.id(), c1.id()), store.getPath());
        // reverted blocks stay retrievable for a later reorg back
        assertTrue(store.getBlock(b2.id()).isPresent());
    }

    @Test
    void rejectsNonContiguousEntries() {
        ChainStore store = store();
        Block g = block(null, 0);
        Block b1 = block(g, 0);
        store.commitPath(-1, List.of(entry(g)));

        assertThrows(IllegalArgumentException.class, () -> store.commitPath(1, List.of(entry(b1))));
        assertThrows(IllegalArgumentException.class, () -> store.commitPath(-1, List.of(entry(b1))));
        assertEquals(List.of(g.id()), store.getPath());
    }

    @Test
    void putBlockKeepsSideChainBodies() {
        ChainStore store = store();
        Block g = block(null, 0);
        store.putBlock(g);
        store.putBlock(g);

        assertEquals(1, store.size());
        assertTrue(store.getPath().isEmpty());
        assertTrue(store.getDiffs(g.id()).isEmpty());
    }
}
