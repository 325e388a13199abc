package com.demoLibrary.multiModel.aggregate.exception;

/**
 * Thrown when the backing store cannot be read.
 */
public class SourceRetrievalException extends RuntimeException {

    public SourceRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
