package com.wom.openings.service;

import com.wom.openings.model.CanonicalRecord;

import java.util.*;

/**
 * Run-scoped merge state: keys seen so far and the surviving records in arrival order.
 * Not thread-safe; a run is single-threaded.
 */
public class DeduplicationContext {

    private final Set<String> seenKeys;
    private final List<CanonicalRecord> survivors = new ArrayList<>();

    public DeduplicationContext() {
        this(Set.of());
    }

    public DeduplicationContext(Collection<String> preSeeded) {
        this.seenKeys = new HashSet<>(preSeeded);
    }

    boolean markSeen(String key) {
        return seenKeys.add(key);
    }

    void keep(CanonicalRecord record) {
        survivors.add(record);
    }

    public boolean hasSeen(String key) {
        return seenKeys.contains(key);
    }

    public List<CanonicalRecord> survivors() {
        return Collections.unmodifiableList(survivors);
    }
}
