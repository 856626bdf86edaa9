package com.esports.dashboard.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Optional;

/**
 * Result cache used by the dashboard services.
 *
 * Implementations must degrade to "always miss / no-op" when the backing
 * store is unavailable instead of failing the request.
 */
public interface QueryCache {

    <T> Optional<T> get(String key, TypeReference<T> type);

    void set(String key, Object value, long ttlSeconds);

    void delete(String key);

    /**
     * Delete every key matching a glob pattern.
     *
     * @return number of keys removed
     */
    long deletePattern(String pattern);
}
