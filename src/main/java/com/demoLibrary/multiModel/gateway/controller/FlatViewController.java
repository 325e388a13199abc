package com.demoLibrary.multiModel.gateway.controller;

import com.demoLibrary.multiModel.aggregate.model.RequestContext;
import com.demoLibrary.multiModel.aggregate.service.FlatMultipleModelService;
import com.demoLibrary.multiModel.aggregate.service.FlatViewRegistry;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import com.demoLibrary.multiModel.gateway.dto.FlatPage;
import com.demoLibrary.multiModel.gateway.service.CorrelationIdService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Flat view REST controller - thin HTTP layer over the aggregation pipeline.
 * 
 * Responsibilities:
 * - Route {@code /api/v1/flat/{view}} to the registered view
 * - Build the request context (query params, path variables, correlation ID)
 * - Page the result when {@code limit} is given
 * Only GET is mapped; other methods are answered with 405 by {@link GlobalExceptionHandler}.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/flat")
@RequiredArgsConstructor
public class FlatViewController {

    private static final String VIEW_PATH_VARIABLE = "view";
    private static final String LIMIT_PARAM = "limit";
    private static final String OFFSET_PARAM = "offset";

    private final FlatViewRegistry flatViewRegistry;
    private final FlatMultipleModelService flatMultipleModelService;
    private final CorrelationIdService correlationIdService;

    /**
     * Lists the records of a flat view.
     * 
     * @param pathVariables route variables; {@code view} selects the view, the rest are passed on
     * @param queryParams query string, visible to filter backends and source filters
     * @param limit optional page size
     * @param offset page start, used with {@code limit}
     * @param correlationIdHeader optional caller-supplied correlation ID
     * @return JSON array of records, or a {@link FlatPage} when {@code limit} is given
     */
    @GetMapping({"/{view}", "/{view}/{slug}"})
    public ResponseEntity<?> list(
            @PathVariable Map<String, String> pathVariables,
            @RequestParam Map<String, String> queryParams,
            @RequestParam(value = LIMIT_PARAM, required = false) @Min(1) @Max(1000) Integer limit,
            @RequestParam(value = OFFSET_PARAM, required = false, defaultValue = "0") @Min(0) Integer offset,
            @RequestHeader(value = CorrelationIdService.CORRELATION_ID_HEADER, required = false) String correlationIdHeader) {

        String viewName = pathVariables.get(VIEW_PATH_VARIABLE);
        FlatMultipleModelView view = flatViewRegistry.get(viewName);

        Map<String, String> viewPathVariables = new HashMap<>(pathVariables);
        viewPathVariables.remove(VIEW_PATH_VARIABLE);

        RequestContext context = RequestContext.builder()
                .correlationId(correlationIdService.resolveCorrelationId(correlationIdHeader))
                .viewName(viewName)
                .method("GET")
                .queryParams(Map.copyOf(queryParams))
                .pathVariables(Map.copyOf(viewPathVariables))
                .receivedAt(Instant.now())
                .build();

        log.info("Flat view request - correlationId: {}, view: {}, params: {}",
                context.getCorrelationId(), viewName, queryParams.keySet());

        List<Document> records = flatMultipleModelService.list(view, context);

        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                .header(CorrelationIdService.CORRELATION_ID_HEADER, context.getCorrelationId());
        if (limit != null) {
            return response.body(FlatPage.of(records, limit, offset));
        }
        return response.body(records);
    }
}
