package com.demoLibrary.multiModel.aggregate.query;

import org.bson.Document;

import java.util.List;

/**
 * Converts one raw entity into an ordered field mapping.
 *
 * @param <T> raw entity type
 */
public interface RecordSerializer<T> {

    /**
     * Builds a new record for the entity. Implementations must not mutate the entity.
     */
    Document serialize(T entity);

    /**
     * Field names this serializer produces, in output order.
     */
    List<String> getFieldNames();
}
