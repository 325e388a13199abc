package com.demoLibrary.multiModel.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A play in the catalog.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class Play {

    private Long id;

    /**
     * Genre, e.g. "Tragedy" or "Comedy".
     */
    private String genre;

    private String title;

    /**
     * Year of first publication or performance.
     */
    private Integer year;
}
