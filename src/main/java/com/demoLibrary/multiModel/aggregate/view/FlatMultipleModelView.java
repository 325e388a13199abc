package com.demoLibrary.multiModel.aggregate.view;

import com.demoLibrary.multiModel.aggregate.model.RequestContext;
import com.demoLibrary.multiModel.aggregate.model.SortingField;
import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import com.demoLibrary.multiModel.aggregate.query.FilterBackend;
import com.demoLibrary.multiModel.aggregate.query.QueryCache;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Definition of one flat multiple-model endpoint.
 * 
 * Subclasses either assign {@link #querylist} in their constructor or override
 * {@link #getQuerylist(RequestContext)} to build the descriptors from the request
 * (e.g. from a path variable). The remaining fields tune labelling, filtering and sorting.
 */
public abstract class FlatMultipleModelView {

    public static final String DEFAULT_SORTING_PARAMETER_NAME = "o";

    /**
     * Static querylist. Left null when {@link #getQuerylist(RequestContext)} is overridden.
     */
    protected List<SourceDescriptor<?>> querylist;

    /**
     * Adds a {@code type} key with the source label to every record.
     */
    @Getter
    protected boolean addModelType = true;

    /**
     * Single sort field, {@code "-"} prefix for descending. Superseded by {@link #sortingFields}.
     */
    protected String sortingField;

    protected List<String> sortingFields;

    /**
     * Maps public sort names (as accepted in the request) to record keys.
     */
    protected Map<String, String> sortingFieldsMap = Map.of();

    /**
     * Query parameter that overrides the configured sort fields. Null disables the override.
     */
    @Getter
    @Setter
    protected String sortingParameterName = DEFAULT_SORTING_PARAMETER_NAME;

    @Getter
    protected List<FilterBackend> filterBackends = List.of();

    /**
     * Fields inspected by search-style filter backends.
     */
    @Getter
    protected List<String> searchFields = List.of();

    /**
     * Optional cache for base queries, keyed by model name.
     */
    @Getter
    protected QueryCache queryCache;

    /**
     * Returns the descriptors for this request. May return null when neither the static
     * querylist is set nor this method is overridden; validation reports that case.
     */
    public List<SourceDescriptor<?>> getQuerylist(RequestContext request) {
        return querylist;
    }

    public String getViewName() {
        return getClass().getSimpleName();
    }

    /**
     * Resolves the sort instructions for a request. The request parameter, when present,
     * replaces the configured fields.
     */
    public List<SortingField> resolveSortingFields(RequestContext request) {
        List<String> raw = configuredSortingFields();
        if (sortingParameterName != null) {
            String requested = request.getQueryParam(sortingParameterName);
            if (requested != null && !requested.isBlank()) {
                raw = Arrays.stream(requested.split(","))
                        .map(String::trim)
                        .filter(field -> !field.isEmpty())
                        .toList();
            }
        }

        List<SortingField> resolved = new ArrayList<>();
        for (String field : raw) {
            resolved.add(SortingField.parse(field, sortingFieldsMap));
        }
        return resolved;
    }

    private List<String> configuredSortingFields() {
        if (sortingFields != null && !sortingFields.isEmpty()) {
            return sortingFields;
        }
        if (sortingField != null && !sortingField.isBlank()) {
            return List.of(sortingField);
        }
        return List.of();
    }
}
