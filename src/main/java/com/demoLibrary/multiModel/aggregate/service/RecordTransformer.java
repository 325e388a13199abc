package com.demoLibrary.multiModel.aggregate.service;

import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw entities into records and tags them with their source label.
 */
@Service
public class RecordTransformer {

    public static final String TYPE_KEY = "type";

    public <T> List<Document> transform(List<T> entities, SourceDescriptor<T> descriptor, boolean addModelType) {
        String label = addModelType ? resolveLabel(descriptor) : null;

        List<Document> records = new ArrayList<>(entities.size());
        for (T entity : entities) {
            Document record = descriptor.getSerializerClass().serialize(entity);
            if (label != null) {
                record.put(TYPE_KEY, label);
            }
            records.add(record);
        }
        return records;
    }

    /**
     * Explicit label if set, otherwise the model name of the source query.
     */
    public String resolveLabel(SourceDescriptor<?> descriptor) {
        if (descriptor.getLabel() != null) {
            return descriptor.getLabel();
        }
        return descriptor.getQueryset().getModelName();
    }
}
