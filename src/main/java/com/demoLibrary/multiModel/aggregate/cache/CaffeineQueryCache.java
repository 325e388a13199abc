package com.demoLibrary.multiModel.aggregate.cache;

import com.demoLibrary.multiModel.aggregate.query.EntityQuery;
import com.demoLibrary.multiModel.aggregate.query.QueryCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Query cache backed by Caffeine.
 * 
 * Entries expire a fixed time after they are written, so a cached collection is at most
 * {@code multi-model.cache.ttl} old. Invalidation beyond that is up to callers.
 */
@Slf4j
@Component
public class CaffeineQueryCache implements QueryCache {

    private final Cache<String, EntityQuery<?>> cache;

    public CaffeineQueryCache(@Value("${multi-model.cache.ttl:5m}") Duration ttl,
                              @Value("${multi-model.cache.maximum-size:1000}") long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .removalListener((key, value, cause) ->
                        log.debug("Query cache entry removed - key: {}, cause: {}", key, cause))
                .build();
    }

    @Override
    public Optional<EntityQuery<?>> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void set(String key, EntityQuery<?> query) {
        cache.put(key, query);
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
