package com.demoLibrary.multiModel.catalog.view;

import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import com.demoLibrary.multiModel.catalog.serializer.PlaySerializer;
import com.demoLibrary.multiModel.catalog.serializer.PoemSerializer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * All plays followed by all sonnets, each tagged with its model name.
 * Sortable per request with {@code ?o=title} or {@code ?o=-title}.
 */
@Component("catalog")
public class CatalogView extends FlatMultipleModelView {

    public CatalogView(CatalogQueries queries) {
        this.querylist = List.of(
                SourceDescriptor.of(queries.plays(), new PlaySerializer()),
                SourceDescriptor.of(queries.sonnets(), new PoemSerializer()));
    }
}
