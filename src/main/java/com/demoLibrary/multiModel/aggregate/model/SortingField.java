package com.demoLibrary.multiModel.aggregate.model;

import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A parsed sort instruction. {@code "-title"} sorts descending by {@code title};
 * {@code "author__name"} walks into the nested {@code author} map.
 */
@Value
public class SortingField {

    private static final String DESCENDING_PREFIX = "-";
    private static final String PATH_SEPARATOR = "__";

    String field;
    boolean descending;

    public static SortingField parse(String raw) {
        return parse(raw, Map.of());
    }

    /**
     * Parses a raw sort instruction, translating the field through {@code fieldsMap} when present.
     */
    public static SortingField parse(String raw, Map<String, String> fieldsMap) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Sorting field must not be blank");
        }
        String trimmed = raw.trim();
        boolean descending = trimmed.startsWith(DESCENDING_PREFIX);
        String name = descending ? trimmed.substring(DESCENDING_PREFIX.length()) : trimmed;
        return new SortingField(fieldsMap.getOrDefault(name, name), descending);
    }

    public List<String> getPath() {
        return Arrays.asList(field.split(PATH_SEPARATOR));
    }

    @Override
    public String toString() {
        return (descending ? DESCENDING_PREFIX : "") + field;
    }
}
