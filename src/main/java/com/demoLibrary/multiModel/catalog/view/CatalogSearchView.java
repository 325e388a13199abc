package com.demoLibrary.multiModel.catalog.view;

import com.demoLibrary.multiModel.aggregate.filter.SearchFilterBackend;
import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import com.demoLibrary.multiModel.catalog.serializer.PlaySerializer;
import com.demoLibrary.multiModel.catalog.serializer.PoemSerializer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Catalog narrowed by {@code ?search=} on titles, across plays and sonnets alike.
 */
@Component("catalog-search")
public class CatalogSearchView extends FlatMultipleModelView {

    public CatalogSearchView(CatalogQueries queries, SearchFilterBackend searchFilterBackend) {
        this.querylist = List.of(
                SourceDescriptor.of(queries.plays(), new PlaySerializer()),
                SourceDescriptor.of(queries.sonnets(), new PoemSerializer()));
        this.filterBackends = List.of(searchFilterBackend);
        this.searchFields = List.of("title");
    }
}
