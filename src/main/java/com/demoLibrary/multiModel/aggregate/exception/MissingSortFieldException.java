package com.demoLibrary.multiModel.aggregate.exception;

import lombok.Getter;

/**
 * Thrown when at least one record lacks the field the results are sorted by.
 */
@Getter
public class MissingSortFieldException extends RuntimeException {

    private final String path;
    private final int recordIndex;

    public MissingSortFieldException(String path, int recordIndex) {
        super("Invalid sorting field: " + path);
        this.path = path;
        this.recordIndex = recordIndex;
    }
}
