package io.scoreline.tx.starter.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scoreline.tx.core.cache.KeyValueCache;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Redis-backed cache storing values as JSON strings under a key prefix.
 */
public class RedissonKeyValueCache implements KeyValueCache {

    private static final Logger log = LoggerFactory.getLogger(RedissonKeyValueCache.class);

    private final RedissonClient redissonClient;
    private final ObjectMapper objectMapper;
    private final String prefix;

    public RedissonKeyValueCache(RedissonClient redissonClient, ObjectMapper objectMapper, String prefix) {
        if (redissonClient == null) {
            throw new IllegalArgumentException("RedissonClient cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("ObjectMapper cannot be null");
        }
        this.redissonClient = redissonClient;
        this.objectMapper = objectMapper;
        this.prefix = (prefix == null || prefix.trim().isEmpty()) ? "scoreline:cache:" : prefix;
    }

    @Override
    public <T> T get(String key, TypeReference<T> type) {
        if (key == null || key.trim().isEmpty()) {
            return null;
        }

        String json;
        try {
            RBucket<String> bucket = redissonClient.getBucket(prefix + key);
            json = bucket.get();
        } catch (Exception e) {
            log.error("Failed to get cache: {}", key, e);
            return null;
        }

        if (json == null) {
            log.debug("Cache miss: {}", key);
            return null;
        }

        try {
            T value = objectMapper.readValue(json, type);
            log.debug("Cache hit: {}", key);
            return value;
        } catch (Exception e) {
            log.error("Failed to read cache: {} - evicting corrupt entry", key, e);
            invalidate(key);
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
            RBucket<String> bucket = redissonClient.getBucket(prefix + key);
            bucket.set(json, ttl);
            log.debug("Cache stored: {} (TTL: {}s)", key, ttl.getSeconds());
        } catch (Exception e) {
            log.error("Failed to put cache: {}", key, e);
        }
    }

    @Override
    public void invalidate(String key) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }

        try {
            boolean deleted = redissonClient.getBucket(prefix + key).delete();
            if (deleted) {
                log.debug("Cache evicted: {}", key);
            }
        } catch (Exception e) {
            log.error("Failed to evict cache: {}", key, e);
        }
    }
}
