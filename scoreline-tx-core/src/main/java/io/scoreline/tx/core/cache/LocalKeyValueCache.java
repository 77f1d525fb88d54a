package io.scoreline.tx.core.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process cache. Values are stored as JSON so callers always get their own
 * copy back, the same as with the Redis-backed cache.
 */
public class LocalKeyValueCache implements KeyValueCache {

    private static final Logger log = LoggerFactory.getLogger(LocalKeyValueCache.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LocalKeyValueCache(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    public LocalKeyValueCache(ObjectMapper objectMapper, Clock clock) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("ObjectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public <T> T get(String key, TypeReference<T> type) {
        if (key == null || key.trim().isEmpty()) {
            return null;
        }
        Entry entry = entries.get(key);
        if (entry == null) {
            log.debug("Cache miss: {}", key);
            return null;
        }
        if (entry.expiresAtMs <= clock.millis()) {
            entries.remove(key, entry);
            log.debug("Cache expired: {}", key);
            return null;
        }
        try {
            T value = objectMapper.readValue(entry.json, type);
            log.debug("Cache hit: {}", key);
            return value;
        } catch (Exception e) {
            log.error("Failed to read cache: {} - evicting", key, e);
            entries.remove(key);
            return null;
        }
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        if (key == null || key.trim().isEmpty() || value == null) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(value);
            entries.put(key, new Entry(json, clock.millis() + ttl.toMillis()));
            log.debug("Cache stored: {} (TTL: {}s)", key, ttl.getSeconds());
        } catch (Exception e) {
            log.error("Failed to put cache: {}", key, e);
        }
    }

    @Override
    public void invalidate(String key) {
        if (key == null) {
            return;
        }
        if (entries.remove(key) != null) {
            log.debug("Cache evicted: {}", key);
        }
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry {
        private final String json;
        private final long expiresAtMs;

        private Entry(String json, long expiresAtMs) {
            this.json = json;
            this.expiresAtMs = expiresAtMs;
        }
    }
}
