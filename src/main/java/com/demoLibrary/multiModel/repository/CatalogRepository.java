package com.demoLibrary.multiModel.repository;

import com.demoLibrary.multiModel.aggregate.exception.SourceRetrievalException;
import com.demoLibrary.multiModel.util.JsonFileLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Read-only catalog store backed by JSON files in the classpath.
 * 
 * Each collection maps to a file under {@code resources/data} holding an array of objects.
 * Every executed query is counted, which lets callers assert how many round trips a
 * request caused.
 */
@Repository
public class CatalogRepository {

    private static final Logger log = LoggerFactory.getLogger(CatalogRepository.class);

    // Map collection names to JSON file paths in resources/data
    private static final Map<String, String> COLLECTION_TO_FILE_MAP = Map.of(
        "plays", "data/plays.json",
        "poems", "data/poems.json"
    );

    private final AtomicLong queryCount = new AtomicLong();

    /**
     * Starts an unevaluated query over a collection.
     * 
     * @param collection The collection name (maps to a JSON file)
     * @param model The entity class each JSON object is read into
     * @return A query that has not touched the store yet
     */
    public <T> RepositoryQuery<T> query(String collection, Class<T> model) {
        requireKnown(collection);
        return new RepositoryQuery<>(this, collection, model);
    }

    /**
     * Executes one query: loads the collection and keeps the entities matching the predicate,
     * in file order.
     * 
     * @throws SourceRetrievalException if the collection file cannot be read
     */
    public <T> List<T> findAll(String collection, Class<T> model, Predicate<? super T> predicate) {
        String filePath = requireKnown(collection);
        queryCount.incrementAndGet();

        try {
            List<T> entities = JsonFileLoader.loadAsList(filePath, model).stream()
                    .filter(predicate)
                    .toList();
            log.debug("Query on collection: {} returned {} {} entities", collection, entities.size(), model.getSimpleName());
            return entities;
        } catch (IOException e) {
            log.error("Failed to load JSON file: {}", filePath, e);
            throw new SourceRetrievalException("Failed to read collection: " + collection, e);
        }
    }

    /**
     * Counts matching entities. Counts as one query.
     */
    public <T> long count(String collection, Class<T> model, Predicate<? super T> predicate) {
        return findAll(collection, model, predicate).size();
    }

    public long getQueryCount() {
        return queryCount.get();
    }

    public void resetQueryCount() {
        queryCount.set(0);
    }

    private String requireKnown(String collection) {
        String filePath = COLLECTION_TO_FILE_MAP.get(collection);
        if (filePath == null) {
            log.warn("Unknown collection: {}", collection);
            throw new IllegalArgumentException("Unknown collection: " + collection);
        }
        return filePath;
    }
}
