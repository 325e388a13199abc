package com.demoLibrary.multiModel.aggregate.query;

import java.util.List;
import java.util.function.Predicate;

/**
 * Unexecuted retrieval handle over a collection of raw entities of one kind.
 * 
 * Narrowing operations return new queries and never touch the backing store;
 * only {@link #fetch()} and {@link #count()} execute.
 *
 * @param <T> raw entity type
 */
public interface EntityQuery<T> {

    /**
     * Name of the entity kind (e.g. "Play"), used as the default provenance label
     * and as part of cache keys.
     */
    String getModelName();

    /**
     * Fresh, unevaluated copy of this query.
     */
    EntityQuery<T> all();

    EntityQuery<T> filter(Predicate<? super T> predicate);

    EntityQuery<T> exclude(Predicate<? super T> predicate);

    /**
     * Evaluates the query. The result is memoized, so repeated calls on the same
     * instance hit the backing store at most once.
     */
    List<T> fetch();

    long count();
}
