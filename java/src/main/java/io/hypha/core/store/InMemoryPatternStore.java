package io.hypha.core.store;

import io.hypha.core.spi.PatternStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of {@link PatternStore}.
 *
 * <p>Keys are held in a sorted map, so {@link #keys(String)} yields them in lexicographic order.
 * Suitable for tests and single-process deployments; nothing survives a restart.
 */
public final class InMemoryPatternStore implements PatternStore {

    private final ConcurrentSkipListMap<String, Map<String, String>> hashes = new ConcurrentSkipListMap<>();

    @Override
    public boolean exists(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        GlobPattern glob = GlobPattern.compile(pattern);
        if (glob.isLiteral()) {
            return hashes.containsKey(pattern);
        }
        return hashes.keySet().stream().anyMatch(glob::matches);
    }

    @Override
    public List<String> keys(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        GlobPattern glob = GlobPattern.compile(pattern);
        List<String> matches = new ArrayList<>();
        for (String key : hashes.keySet()) {
            if (glob.matches(key)) {
                matches.add(key);
            }
        }
        return matches;
    }

    @Override
    public void hset(String key, String field, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(field, "field");
        Map<String, String> hash = hashes.computeIfAbsent(key, k -> new LinkedHashMap<>());
        synchronized (hash) {
            if (value == null) {
                hash.remove(field);
            } else {
                hash.put(field, value);
            }
        }
    }

    @Override
    public Map<String, String> hgetall(String key) {
        Objects.requireNonNull(key, "key");
        Map<String, String> hash = hashes.get(key);
        if (hash == null) {
            return Map.of();
        }
        synchronized (hash) {
            return new LinkedHashMap<>(hash);
        }
    }

    @Override
    public int delete(String pattern) {
        int removed = 0;
        for (String key : keys(pattern)) {
            if (hashes.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return hashes.size();
    }
}
