package io.consensusset.core.storage;

import io.consensusset.core.protocol.Block;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBChainStoreTest extends ChainStoreContract {

    @TempDir
    Path dir;

    private RocksDBChainStore store;

    @BeforeEach
    void setUp() {
        store = RocksDBChainStore.open(dir.toString());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Override
    ChainStore store() {
        return store;
    }

    @Test
    void pathSurvivesReopen() {
        Block g = block(null, 0);
        Block b1 = block(g, 0);
        store.commitPath(-1, List.of(entry(g), entry(b1)));
        store.close();

        store = RocksDBChainStore.open(dir.toString());
        assertEquals(List.of(g.id(), b1.id()), store.getPath());
        assertEquals(entry(b1).diffs(), store.getDiffs(b1.id()).orElseThrow());
    }
}
