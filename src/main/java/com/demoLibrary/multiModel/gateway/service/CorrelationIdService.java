package com.demoLibrary.multiModel.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating correlation IDs for request tracking.
 */
@Service
public class CorrelationIdService {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    /**
     * Reuses the caller's correlation ID when supplied, otherwise generates one.
     *
     * @param incoming value of the {@value #CORRELATION_ID_HEADER} header, may be null
     * @return correlation ID for this request
     */
    public String resolveCorrelationId(String incoming) {
        if (incoming != null && !incoming.isBlank()) {
            return incoming.trim();
        }
        return UUID.randomUUID().toString();
    }
}
