package com.demoLibrary.multiModel.aggregate.service;

import com.demoLibrary.multiModel.aggregate.model.RequestContext;
import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import com.demoLibrary.multiModel.aggregate.query.EntityQuery;
import com.demoLibrary.multiModel.aggregate.query.FilterBackend;
import com.demoLibrary.multiModel.aggregate.query.QueryCache;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves one source descriptor into its raw entities.
 * 
 * Order of narrowing:
 * 1. base query (fresh copy, or the cached one when the view has a cache)
 * 2. the view's filter backends, in declared order
 * 3. the descriptor's own filter function
 * The resulting query is evaluated exactly once.
 */
@Slf4j
@Service
public class SourceFetcher {

    public <T> List<T> fetch(SourceDescriptor<T> descriptor, FlatMultipleModelView view, RequestContext request) {
        EntityQuery<T> query = loadQueryset(descriptor, view.getQueryCache(), request);

        for (FilterBackend backend : view.getFilterBackends()) {
            query = backend.filterQueryset(query, request, view);
        }

        if (descriptor.hasFilterFn()) {
            query = descriptor.getFilterFn().apply(query, request);
        }

        List<T> entities = query.fetch();
        log.debug("Fetched source - correlationId: {}, model: {}, count: {}",
                request.getCorrelationId(), query.getModelName(), entities.size());
        return entities;
    }

    /**
     * Loads the base query of a descriptor, going through the cache when one is configured.
     */
    @SuppressWarnings("unchecked")
    <T> EntityQuery<T> loadQueryset(SourceDescriptor<T> descriptor, QueryCache cache, RequestContext request) {
        if (cache == null) {
            return descriptor.getQueryset().all();
        }

        String key = QueryCache.keyFor(descriptor.getQueryset());
        Optional<EntityQuery<?>> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Query cache hit - correlationId: {}, key: {}", request.getCorrelationId(), key);
            return (EntityQuery<T>) cached.get();
        }

        EntityQuery<T> query = descriptor.getQueryset().all();
        cache.set(key, query);
        log.debug("Query cache miss - correlationId: {}, key: {}", request.getCorrelationId(), key);
        return query;
    }
}
