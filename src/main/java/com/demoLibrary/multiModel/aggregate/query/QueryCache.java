package com.demoLibrary.multiModel.aggregate.query;

import java.util.Optional;

/**
 * Side interface for caching base queries between requests.
 * Keys follow the {@code "<ModelName>-queryset"} convention, see {@link #keyFor(EntityQuery)}.
 */
public interface QueryCache {

    Optional<EntityQuery<?>> get(String key);

    void set(String key, EntityQuery<?> query);

    static String keyFor(EntityQuery<?> query) {
        return query.getModelName() + "-queryset";
    }
}
