package com.demoLibrary.multiModel.aggregate.service;

import org.bson.Document;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Concatenates per-source records in descriptor order.
 */
@Service
public class FlatAggregator {

    public List<Document> flatten(List<List<Document>> perSource) {
        int total = perSource.stream().mapToInt(List::size).sum();
        List<Document> results = new ArrayList<>(total);
        for (List<Document> records : perSource) {
            results.addAll(records);
        }
        return results;
    }
}
