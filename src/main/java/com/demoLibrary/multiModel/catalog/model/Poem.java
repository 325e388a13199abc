package com.demoLibrary.multiModel.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A poem in the catalog.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class Poem {

    private Long id;

    private String title;

    /**
     * Poetic form, e.g. "Sonnet".
     */
    private String style;
}
