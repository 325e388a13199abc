package com.demoLibrary.multiModel.aggregate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Request context passed through the aggregation pipeline.
 * Contains everything a view or a source filter may read from the incoming request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    /**
     * Correlation ID for request tracking in logs.
     */
    private String correlationId;

    /**
     * Name of the view the request was routed to.
     */
    private String viewName;

    /**
     * HTTP method, upper case.
     */
    @Builder.Default
    private String method = "GET";

    /**
     * Query string parameters (first value per name).
     */
    @Builder.Default
    private Map<String, String> queryParams = Map.of();

    /**
     * Path variables captured by the route, minus the view name.
     */
    @Builder.Default
    private Map<String, String> pathVariables = Map.of();

    /**
     * Timestamp when the request was received.
     */
    private Instant receivedAt;

    public String getQueryParam(String name) {
        return queryParams != null ? queryParams.get(name) : null;
    }

    public String getPathVariable(String name) {
        return pathVariables != null ? pathVariables.get(name) : null;
    }
}
