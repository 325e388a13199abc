package com.demoLibrary.multiModel.aggregate.exception;

public class UnknownViewException extends RuntimeException {

    public UnknownViewException(String viewName) {
        super("No flat view registered under name: " + viewName);
    }
}
