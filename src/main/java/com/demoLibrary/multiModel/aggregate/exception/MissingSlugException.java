package com.demoLibrary.multiModel.aggregate.exception;

/**
 * Exception thrown when a view needs the slug path segment and the request has none.
 */
public class MissingSlugException extends RuntimeException {

    public MissingSlugException(String message) {
        super(message);
    }
}
