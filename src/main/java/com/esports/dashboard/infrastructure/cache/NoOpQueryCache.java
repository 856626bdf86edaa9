package com.esports.dashboard.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Cache used when caching is switched off: every read misses, every write is dropped.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.cache.enabled", havingValue = "false")
public class NoOpQueryCache implements QueryCache {

    public NoOpQueryCache() {
        log.info("Query cache disabled, all dashboard queries hit the database");
    }

    @Override
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return Optional.empty();
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
    }

    @Override
    public void delete(String key) {
    }

    @Override
    public long deletePattern(String pattern) {
        return 0;
    }
}
