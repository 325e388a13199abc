package com.demoLibrary.multiModel.aggregate.exception;

/**
 * Thrown when two values of a sort field cannot be put in a total order
 * (nulls, lists, maps, or values of unrelated types).
 */
public class IncomparableSortValuesException extends RuntimeException {

    public IncomparableSortValuesException(String message) {
        super(message);
    }
}
