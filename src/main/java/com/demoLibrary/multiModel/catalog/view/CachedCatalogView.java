package com.demoLibrary.multiModel.catalog.view;

import com.demoLibrary.multiModel.aggregate.cache.CaffeineQueryCache;
import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import com.demoLibrary.multiModel.catalog.serializer.PlaySerializer;
import com.demoLibrary.multiModel.catalog.serializer.PoemSerializer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Same content as {@link CatalogView}, with base queries kept in the query cache so
 * repeated requests are served without touching the repository.
 */
@Component("catalog-cached")
public class CachedCatalogView extends FlatMultipleModelView {

    public CachedCatalogView(CatalogQueries queries, CaffeineQueryCache queryCache) {
        this.querylist = List.of(
                SourceDescriptor.of(queries.plays(), new PlaySerializer()),
                SourceDescriptor.of(queries.sonnets(), new PoemSerializer()));
        this.queryCache = queryCache;
    }
}
