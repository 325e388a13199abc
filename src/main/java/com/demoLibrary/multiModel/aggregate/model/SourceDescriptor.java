package com.demoLibrary.multiModel.aggregate.model;

import com.demoLibrary.multiModel.aggregate.query.EntityQuery;
import com.demoLibrary.multiModel.aggregate.query.RecordSerializer;
import com.demoLibrary.multiModel.aggregate.query.SourceFilter;
import lombok.Value;
import lombok.With;

/**
 * One entry of a view's querylist: where the records come from and how they are serialized.
 * 
 * Built once per request and never modified afterwards. Optional parts are attached with
 * the generated {@code with*} methods:
 * <pre>
 * SourceDescriptor.of(plays, new PlaySerializer())
 *         .withLabel("Drama")
 *         .withFilterFn(titleWithoutLetter);
 * </pre>
 */
@Value
public class SourceDescriptor<T> {

    /**
     * Retrieval handle; required.
     */
    EntityQuery<T> queryset;

    /**
     * Record serializer; required.
     */
    RecordSerializer<T> serializerClass;

    /**
     * Provenance label. When null the query's model name is used.
     */
    @With
    String label;

    /**
     * Optional per-source, request-scoped filter.
     */
    @With
    SourceFilter<T> filterFn;

    public static <T> SourceDescriptor<T> of(EntityQuery<T> queryset, RecordSerializer<T> serializerClass) {
        return new SourceDescriptor<>(queryset, serializerClass, null, null);
    }

    public boolean hasFilterFn() {
        return filterFn != null;
    }
}
