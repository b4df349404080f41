package io.consensusset.core.state;

import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Coin outputs waiting for their maturity height, bucketed by that height.
 * A bucket exists only while it holds at least one output.
 */
public final class MaturityQueue {

    private final NavigableMap<Long, LedgerRegistry<SiacoinOutput>> buckets = new TreeMap<>();

    LedgerRegistry<SiacoinOutput> bucket(long maturityHeight) {
        return buckets.computeIfAbsent(maturityHeight, h -> new LedgerRegistry<>());
    }

    Optional<LedgerRegistry<SiacoinOutput>> existingBucket(long maturityHeight) {
        return Optional.ofNullable(buckets.get(maturityHeight));
    }

    void dropIfEmpty(long maturityHeight) {
        LedgerRegistry<SiacoinOutput> b = buckets.get(maturityHeight);
        if (b != null && b.isEmpty()) {
            buckets.remove(maturityHeight);
        }
    }

    /** Outputs maturing at {@code maturityHeight}, ordered by id; empty if there is no bucket. */
    public Map<Hash, SiacoinOutput> outputsAt(long maturityHeight) {
        LedgerRegistry<SiacoinOutput> b = buckets.get(maturityHeight);
        return b == null ? Collections.emptyMap() : b.snapshot();
    }

    public boolean hasBucket(long maturityHeight) {
        return buckets.containsKey(maturityHeight);
    }

    public int bucketCount() {
        return buckets.size();
    }

    public Optional<Long> lowestHeight() {
        return buckets.isEmpty() ? Optional.empty() : Optional.of(buckets.firstKey());
    }

    public SortedMap<Long, Map<Hash, SiacoinOutput>> snapshot() {
        SortedMap<Long, Map<Hash, SiacoinOutput>> out = new TreeMap<>();
        for (Map.Entry<Long, LedgerRegistry<SiacoinOutput>> e : buckets.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot());
        }
        return Collections.unmodifiableSortedMap(out);
    }
}
