package io.scoreline.tx.core.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Duration;

/**
 * Minimal cache capability passed to services that cache reads explicitly.
 * Implementations never throw on cache failures; a broken cache behaves
 * like an empty one.
 */
public interface KeyValueCache {

    /**
     * @return the cached value, or null on a miss
     */
    <T> T get(String key, TypeReference<T> type);

    void put(String key, Object value, Duration ttl);

    void invalidate(String key);
}
