package com.demoLibrary.multiModel.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bson.Document;

import java.util.List;

/**
 * Limit/offset page over a flat view's records.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlatPage {

    /**
     * Total number of records before paging.
     */
    private int count;

    private int limit;

    private int offset;

    private List<Document> results;

    public static FlatPage of(List<Document> records, int limit, int offset) {
        int from = Math.min(offset, records.size());
        int to = (int) Math.min((long) from + limit, records.size());
        return FlatPage.builder()
                .count(records.size())
                .limit(limit)
                .offset(offset)
                .results(records.subList(from, to))
                .build();
    }
}
