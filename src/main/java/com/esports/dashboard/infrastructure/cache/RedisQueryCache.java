package com.esports.dashboard.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed query result cache.
 *
 * Values are stored as JSON strings with a TTL.
 *
 * Why Redis?
 * - Shared across service instances
 * - TTL support (automatic eviction)
 * - SCAN-based pattern invalidation without blocking the server
 *
 * Failure Handling:
 * - Redis errors propagate to the "redis" circuit breaker, whose fallbacks
 *   turn them into a miss / no-op
 * - An open circuit short-circuits straight to the fallbacks
 * - Corrupt or incompatible cached JSON is treated as a miss and evicted
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.cache.enabled", havingValue = "true", matchIfMissing = true)
public class RedisQueryCache implements QueryCache {

    private static final int SCAN_BATCH_SIZE = 100;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        String cached = redisTemplate.opsForValue().get(key);

        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }

        try {
            T value = objectMapper.readValue(cached, type);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(value);

        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "setFallback")
    public void set(String key, Object value, long ttlSeconds) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // A value we cannot serialize is simply not cached
            log.error("Error serializing value for cache key {}: {}", key, e.getOriginalMessage());
            return;
        }

        redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
        log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "deleteFallback")
    public void delete(String key) {
        redisTemplate.delete(key);
        log.debug("Deleted cache key: {}", key);
    }

    /**
     * Delete keys matching a glob pattern.
     *
     * Uses SCAN instead of KEYS so large keyspaces are walked incrementally.
     */
    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "deletePatternFallback")
    public long deletePattern(String pattern) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH_SIZE).build();

        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
        }

        if (keys.isEmpty()) {
            return 0;
        }

        Long deleted = redisTemplate.delete(keys);
        long count = deleted != null ? deleted : 0;
        log.info("Invalidated {} cache keys matching {}", count, pattern);
        return count;
    }

    // Fallback methods (circuit breaker)

    private <T> Optional<T> getFallback(String key, TypeReference<T> type, Throwable t) {
        log.warn("Redis unavailable, treating {} as cache miss: {}", key, t.getMessage());
        return Optional.empty();
    }

    private void setFallback(String key, Object value, long ttlSeconds, Throwable t) {
        log.warn("Redis unavailable, skipping cache write for {}: {}", key, t.getMessage());
    }

    private void deleteFallback(String key, Throwable t) {
        log.warn("Redis unavailable, skipping cache delete for {}: {}", key, t.getMessage());
    }

    private long deletePatternFallback(String pattern, Throwable t) {
        log.warn("Redis unavailable, skipping invalidation of {}: {}", pattern, t.getMessage());
        return 0;
    }
}
