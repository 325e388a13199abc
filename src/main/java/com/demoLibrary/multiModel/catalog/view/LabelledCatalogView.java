package com.demoLibrary.multiModel.catalog.view;

import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import com.demoLibrary.multiModel.catalog.serializer.PlaySerializer;
import com.demoLibrary.multiModel.catalog.serializer.PoemSerializer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plays labelled "Drama" and sonnets labelled "Poetry", ordered by title.
 */
@Component("catalog-labelled")
public class LabelledCatalogView extends FlatMultipleModelView {

    public LabelledCatalogView(CatalogQueries queries) {
        this.querylist = List.of(
                SourceDescriptor.of(queries.plays(), new PlaySerializer()).withLabel("Drama"),
                SourceDescriptor.of(queries.sonnets(), new PoemSerializer()).withLabel("Poetry"));
        this.sortingField = "title";
    }
}
