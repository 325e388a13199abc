package com.demoLibrary.multiModel.aggregate.exception;

/**
 * Thrown when a view cannot produce a querylist at all.
 * Indicates a programming error in the endpoint definition rather than a bad request.
 */
public class ImproperlyConfiguredException extends RuntimeException {

    public ImproperlyConfiguredException(String message) {
        super(message);
    }
}
