package io.consensusset.core.state;

import io.consensusset.core.protocol.Hash;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Id-keyed store of one kind of ledger entity. Mutators are package-private: only
 * the commit engine changes a registry. No ledger rules are enforced here.
 */
public final class LedgerRegistry<V> {

    private final Map<Hash, V> entries = new HashMap<>();

    public boolean contains(Hash id) {
        return entries.containsKey(id);
    }

    public Optional<V> get(Hash id) {
        return Optional.ofNullable(entries.get(id));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Unmodifiable copy ordered by id. */
    public Map<Hash, V> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    boolean insertIfAbsent(Hash id, V value) {
        return entries.putIfAbsent(id, value) == null;
    }

    Optional<V> removeIfPresent(Hash id) {
        return Optional.ofNullable(entries.remove(id));
    }
}
