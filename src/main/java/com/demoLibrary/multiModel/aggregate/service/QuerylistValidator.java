package com.demoLibrary.multiModel.aggregate.service;

import com.demoLibrary.multiModel.aggregate.exception.ImproperlyConfiguredException;
import com.demoLibrary.multiModel.aggregate.exception.QuerylistValidationException;
import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Checks a querylist for structural completeness before anything is retrieved.
 */
@Slf4j
@Service
public class QuerylistValidator {

    static final String QUERYSET_KEY = "queryset";
    static final String SERIALIZER_KEY = "serializerClass";

    /**
     * @param viewName name used in error messages
     * @param querylist descriptors resolved for the current request
     * @throws ImproperlyConfiguredException if the querylist is null
     * @throws QuerylistValidationException if an item lacks its queryset or serializer
     */
    public void validate(String viewName, List<SourceDescriptor<?>> querylist) {
        if (querylist == null) {
            throw new ImproperlyConfiguredException(viewName
                    + " should either include a `querylist` attribute, or override the `getQuerylist()` method.");
        }

        for (int i = 0; i < querylist.size(); i++) {
            SourceDescriptor<?> descriptor = querylist.get(i);
            if (descriptor == null || descriptor.getQueryset() == null) {
                log.warn("Querylist item {} of {} has no queryset", i, viewName);
                throw new QuerylistValidationException(viewName, QUERYSET_KEY);
            }
            if (descriptor.getSerializerClass() == null) {
                log.warn("Querylist item {} of {} has no serializer", i, viewName);
                throw new QuerylistValidationException(viewName, SERIALIZER_KEY);
            }
        }
    }
}
