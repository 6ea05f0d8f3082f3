package com.agentloop.core.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the raw content of archived rounds, keyed by round index. Entries are never removed.
 */
public class ArchiveIndex {

    private final LinkedHashMap<Integer, String> entries = new LinkedHashMap<>();

    public void store(int roundIndex, String rawContent) {
        if (entries.putIfAbsent(roundIndex, rawContent) != null) {
            throw new IllegalStateException("Round " + roundIndex + " is already archived");
        }
    }

    public Optional<String> lookup(int roundIndex) {
        return Optional.ofNullable(entries.get(roundIndex));
    }

    public boolean contains(int roundIndex) {
        return entries.containsKey(roundIndex);
    }

    public int size() {
        return entries.size();
    }

    public Map<Integer, String> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    ArchiveIndex copy() {
        var copy = new ArchiveIndex();
        copy.entries.putAll(entries);
        return copy;
    }
}
