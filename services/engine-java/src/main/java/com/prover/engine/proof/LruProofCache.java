package com.prover.engine.proof;

import com.prover.engine.logic.FormulaFingerprint;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded proof cache evicting the least recently used entry.
 */
public class LruProofCache implements ProofCache {

    private final int capacity;
    private final LinkedHashMap<FormulaFingerprint, FormalProof> entries;

    public LruProofCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<FormulaFingerprint, FormalProof> eldest) {
                return size() > LruProofCache.this.capacity;
            }
        };
    }

    @Override
    public synchronized Optional<FormalProof> get(FormulaFingerprint key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized void put(FormulaFingerprint key, FormalProof proof) {
        entries.put(key, proof);
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }

    public int capacity() {
        return capacity;
    }
}
