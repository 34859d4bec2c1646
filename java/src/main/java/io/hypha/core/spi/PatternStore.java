package io.hypha.core.spi;

import java.util.List;
import java.util.Map;

/**
 * Glob-capable key/value store holding the service registry (Redis or an in-memory equivalent).
 * Patterns follow Redis {@code KEYS} syntax.
 */
public interface PatternStore {

    boolean exists(String pattern);

    /**
     * @return keys matching the pattern, in the order the store yields them.
     */
    List<String> keys(String pattern);

    void hset(String key, String field, String value);

    /**
     * @return all fields of the hash, or an empty map when the key is absent.
     */
    Map<String, String> hgetall(String key);

    /**
     * Deletes every key matching the pattern.
     *
     * @return number of keys removed.
     */
    int delete(String pattern);
}
