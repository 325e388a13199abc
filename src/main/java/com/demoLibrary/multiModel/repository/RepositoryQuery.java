package com.demoLibrary.multiModel.repository;

import com.demoLibrary.multiModel.aggregate.query.EntityQuery;

import java.util.List;
import java.util.function.Predicate;

/**
 * Lazy query over one {@link CatalogRepository} collection.
 * 
 * Narrowing composes predicates without touching the store. Evaluation happens once per
 * instance and is memoized. A query narrowed from an already evaluated query filters the
 * memoized entities in memory instead of running another store query.
 */
public class RepositoryQuery<T> implements EntityQuery<T> {

    private final CatalogRepository repository;
    private final String collection;
    private final Class<T> model;
    private final Predicate<T> predicate;
    private final RepositoryQuery<T> evaluatedSource;

    private volatile List<T> resultCache;

    RepositoryQuery(CatalogRepository repository, String collection, Class<T> model) {
        this(repository, collection, model, entity -> true, null);
    }

    private RepositoryQuery(CatalogRepository repository,
                            String collection,
                            Class<T> model,
                            Predicate<T> predicate,
                            RepositoryQuery<T> evaluatedSource) {
        this.repository = repository;
        this.collection = collection;
        this.model = model;
        this.predicate = predicate;
        this.evaluatedSource = evaluatedSource;
    }

    @Override
    public String getModelName() {
        return model.getSimpleName();
    }

    public Class<T> getModel() {
        return model;
    }

    @Override
    public RepositoryQuery<T> all() {
        return new RepositoryQuery<>(repository, collection, model, predicate, null);
    }

    @Override
    public RepositoryQuery<T> filter(Predicate<? super T> condition) {
        Predicate<T> combined = entity -> predicate.test(entity) && condition.test(entity);
        RepositoryQuery<T> source = resultCache != null ? this : evaluatedSource;
        return new RepositoryQuery<>(repository, collection, model, combined, source);
    }

    @Override
    public RepositoryQuery<T> exclude(Predicate<? super T> condition) {
        return filter(entity -> !condition.test(entity));
    }

    @Override
    public List<T> fetch() {
        List<T> result = resultCache;
        if (result == null) {
            synchronized (this) {
                result = resultCache;
                if (result == null) {
                    result = evaluatedSource != null
                            ? evaluatedSource.fetch().stream().filter(predicate).toList()
                            : repository.findAll(collection, model, predicate);
                    resultCache = result;
                }
            }
        }
        return result;
    }

    @Override
    public long count() {
        if (resultCache != null) {
            return resultCache.size();
        }
        if (evaluatedSource != null) {
            return evaluatedSource.fetch().stream().filter(predicate).count();
        }
        return repository.count(collection, model, predicate);
    }

    public boolean isEvaluated() {
        return resultCache != null;
    }

    @Override
    public String toString() {
        return "RepositoryQuery{" + collection + ", model=" + getModelName() + ", evaluated=" + isEvaluated() + "}";
    }
}
