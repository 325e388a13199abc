package com.demoLibrary.multiModel.aggregate.exception;

import lombok.Getter;

/**
 * Thrown when a querylist entry is structurally incomplete.
 */
@Getter
public class QuerylistValidationException extends RuntimeException {

    private final String viewName;
    private final String missingKey;

    public QuerylistValidationException(String viewName, String missingKey) {
        super("All items in the " + viewName + " querylist attribute should contain a `" + missingKey + "` key");
        this.viewName = viewName;
        this.missingKey = missingKey;
    }
}
