package com.demoLibrary.multiModel.aggregate.service;

import com.demoLibrary.multiModel.aggregate.model.RequestContext;
import com.demoLibrary.multiModel.aggregate.model.SortingField;
import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Aggregation pipeline for flat multiple-model views.
 * 
 * Workflow:
 * VALIDATE -> (per descriptor: FETCH -> TRANSFORM) -> FLATTEN -> SORT
 * 
 * The pipeline keeps no state between calls. Any failure aborts the whole request;
 * there is no partial result.
 */
@Slf4j
@Service
public class FlatMultipleModelService {

    private final QuerylistValidator querylistValidator;
    private final SourceFetcher sourceFetcher;
    private final RecordTransformer recordTransformer;
    private final FlatAggregator flatAggregator;
    private final CrossSourceSorter crossSourceSorter;
    private final Executor aggregateExecutor;
    private final boolean parallelFetch;

    public FlatMultipleModelService(QuerylistValidator querylistValidator,
                                    SourceFetcher sourceFetcher,
                                    RecordTransformer recordTransformer,
                                    FlatAggregator flatAggregator,
                                    CrossSourceSorter crossSourceSorter,
                                    @Qualifier("aggregateExecutor") Executor aggregateExecutor,
                                    @Value("${multi-model.parallel-fetch:false}") boolean parallelFetch) {
        this.querylistValidator = querylistValidator;
        this.sourceFetcher = sourceFetcher;
        this.recordTransformer = recordTransformer;
        this.flatAggregator = flatAggregator;
        this.crossSourceSorter = crossSourceSorter;
        this.aggregateExecutor = aggregateExecutor;
        this.parallelFetch = parallelFetch;
    }

    /**
     * Runs the pipeline for one request.
     *
     * @param view view definition
     * @param request request context
     * @return flattened and, when configured, sorted records
     */
    public List<Document> list(FlatMultipleModelView view, RequestContext request) {
        String correlationId = request.getCorrelationId();
        String viewName = view.getViewName();

        List<SourceDescriptor<?>> querylist = view.getQuerylist(request);
        querylistValidator.validate(viewName, querylist);
        log.debug("Querylist validated - correlationId: {}, view: {}, sources: {}",
                correlationId, viewName, querylist.size());

        List<List<Document>> perSource = parallelFetch && querylist.size() > 1
                ? loadAllParallel(querylist, view, request)
                : loadAllSequential(querylist, view, request);

        List<Document> results = flatAggregator.flatten(perSource);

        List<SortingField> sortingFields = view.resolveSortingFields(request);
        results = crossSourceSorter.sort(results, sortingFields);

        log.info("Flat view served - correlationId: {}, view: {}, sources: {}, records: {}, sortedBy: {}",
                correlationId, viewName, querylist.size(), results.size(), sortingFields);
        return results;
    }

    private List<List<Document>> loadAllSequential(List<SourceDescriptor<?>> querylist,
                                                   FlatMultipleModelView view,
                                                   RequestContext request) {
        List<List<Document>> perSource = new ArrayList<>(querylist.size());
        for (SourceDescriptor<?> descriptor : querylist) {
            perSource.add(loadSource(descriptor, view, request));
        }
        return perSource;
    }

    /**
     * Fetches every source on the aggregate executor, then re-serializes by descriptor index.
     */
    private List<List<Document>> loadAllParallel(List<SourceDescriptor<?>> querylist,
                                                 FlatMultipleModelView view,
                                                 RequestContext request) {
        List<CompletableFuture<List<Document>>> futures = new ArrayList<>(querylist.size());
        for (SourceDescriptor<?> descriptor : querylist) {
            futures.add(CompletableFuture.supplyAsync(() -> loadSource(descriptor, view, request), aggregateExecutor));
        }

        List<List<Document>> perSource = new ArrayList<>(futures.size());
        for (CompletableFuture<List<Document>> future : futures) {
            try {
                perSource.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
        }
        return perSource;
    }

    private <T> List<Document> loadSource(SourceDescriptor<T> descriptor,
                                          FlatMultipleModelView view,
                                          RequestContext request) {
        List<T> entities = sourceFetcher.fetch(descriptor, view, request);
        return recordTransformer.transform(entities, descriptor, view.isAddModelType());
    }
}
