package com.demoLibrary.multiModel.aggregate.query;

import com.demoLibrary.multiModel.aggregate.model.RequestContext;

/**
 * Request-scoped narrowing attached to a single source descriptor.
 * Applied after the view's filter backends and only to its own source.
 */
@FunctionalInterface
public interface SourceFilter<T> {

    EntityQuery<T> apply(EntityQuery<T> query, RequestContext request);

    static <T> SourceFilter<T> identity() {
        return (query, request) -> query;
    }
}
