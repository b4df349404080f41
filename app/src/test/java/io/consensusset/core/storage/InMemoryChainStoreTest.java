package io.consensusset.core.storage;

import org.junit.jupiter.api.BeforeEach;

class InMemoryChainStoreTest extends ChainStoreContract {

    private ChainStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryChainStore();
    }

    @Override
    ChainStore store() {
        return store;
    }
}
