package com.demoLibrary.multiModel.gateway.controller;

import com.demoLibrary.multiModel.aggregate.exception.ImproperlyConfiguredException;
import com.demoLibrary.multiModel.aggregate.exception.IncomparableSortValuesException;
import com.demoLibrary.multiModel.aggregate.exception.MissingSlugException;
import com.demoLibrary.multiModel.aggregate.exception.MissingSortFieldException;
import com.demoLibrary.multiModel.aggregate.exception.QuerylistValidationException;
import com.demoLibrary.multiModel.aggregate.exception.SourceRetrievalException;
import com.demoLibrary.multiModel.aggregate.exception.UnknownViewException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Global exception handler for the flat view API.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, String>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        log.warn("Method not allowed: {}", ex.getMethod());
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(Map.of("detail", "Method \"" + ex.getMethod() + "\" not allowed."));
    }

    @ExceptionHandler(QuerylistValidationException.class)
    public ResponseEntity<ErrorResponse> handleQuerylistValidation(QuerylistValidationException ex) {
        log.warn("Querylist validation failed - view: {}, missing: {}", ex.getViewName(), ex.getMissingKey());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(ImproperlyConfiguredException.class)
    public ResponseEntity<ErrorResponse> handleImproperlyConfigured(ImproperlyConfiguredException ex) {
        log.error("Improperly configured view: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("IMPROPERLY_CONFIGURED", ex.getMessage()));
    }

    @ExceptionHandler(MissingSortFieldException.class)
    public ResponseEntity<ErrorResponse> handleMissingSortField(MissingSortFieldException ex) {
        log.warn("Sort field missing on record {}: {}", ex.getRecordIndex(), ex.getPath());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_SORTING_FIELD", ex.getMessage()));
    }

    @ExceptionHandler(IncomparableSortValuesException.class)
    public ResponseEntity<ErrorResponse> handleIncomparableSortValues(IncomparableSortValuesException ex) {
        log.warn("Incomparable sort values: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_SORTING_FIELD", ex.getMessage()));
    }

    @ExceptionHandler(UnknownViewException.class)
    public ResponseEntity<ErrorResponse> handleUnknownView(UnknownViewException ex) {
        log.warn(ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("UNKNOWN_VIEW", ex.getMessage()));
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
            MethodArgumentTypeMismatchException.class, MissingSlugException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(SourceRetrievalException.class)
    public ResponseEntity<ErrorResponse> handleRetrieval(SourceRetrievalException ex) {
        log.error("Source retrieval failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("RETRIEVAL_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    record ErrorResponse(String code, String message) {}
}
