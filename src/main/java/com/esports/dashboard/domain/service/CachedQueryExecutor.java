package com.esports.dashboard.domain.service;

import com.esports.dashboard.infrastructure.cache.CacheKeyBuilder;
import com.esports.dashboard.infrastructure.cache.QueryCache;
import com.esports.dashboard.infrastructure.query.QueryTimeoutGuard;
import com.fasterxml.jackson.core.type.TypeReference;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache-aside envelope shared by every dashboard read.
 *
 * Flow:
 * 1. Build the cache key from the prefix and the filters
 * 2. Inside the timeout guard: check the cache, fetch on miss, store the result
 * 3. Count hits and misses per operation
 *
 * Failure Handling:
 * - A cache that throws is logged and treated as a miss (read) or skipped (write)
 * - A timeout propagates; nothing is cached for it
 * - Fetch errors propagate unchanged
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CachedQueryExecutor {

    private final QueryCache cache;
    private final CacheKeyBuilder keyBuilder;
    private final QueryTimeoutGuard timeoutGuard;
    private final MeterRegistry meterRegistry;

    public <T> T getOrSet(String operation,
                          String prefix,
                          Object params,
                          TypeReference<T> type,
                          long ttlSeconds,
                          long timeoutMs,
                          Supplier<T> fetcher) {
        String key = keyBuilder.build(prefix, params);

        return timeoutGuard.execute(operation, timeoutMs, () -> {
            Optional<T> cached = readCache(key, type);
            if (cached.isPresent()) {
                log.debug("Cache hit: {}", key);
                count(operation, "hit");
                return cached.get();
            }

            log.debug("Cache miss: {}", key);
            count(operation, "miss");

            T result = fetcher.get();
            writeCache(key, result, ttlSeconds);
            return result;
        });
    }

    private <T> Optional<T> readCache(String key, TypeReference<T> type) {
        try {
            return cache.get(key, type);
        } catch (RuntimeException e) {
            log.warn("Cache read failed for {}, querying database: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String key, Object value, long ttlSeconds) {
        try {
            cache.set(key, value, ttlSeconds);
        } catch (RuntimeException e) {
            log.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    private void count(String operation, String result) {
        Counter.builder("dashboard.cache")
                .tag("result", result)
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }
}
