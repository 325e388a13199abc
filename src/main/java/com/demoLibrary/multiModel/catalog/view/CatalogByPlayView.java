package com.demoLibrary.multiModel.catalog.view;

import com.demoLibrary.multiModel.aggregate.exception.MissingSlugException;
import com.demoLibrary.multiModel.aggregate.model.RequestContext;
import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import com.demoLibrary.multiModel.catalog.serializer.PlaySerializer;
import com.demoLibrary.multiModel.catalog.serializer.PoemSerializer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * One play, chosen by the slug in the path ("Julius-Caesar"), followed by all sonnets.
 */
@Component("catalog-by-play")
@RequiredArgsConstructor
public class CatalogByPlayView extends FlatMultipleModelView {

    public static final String PLAY_PATH_VARIABLE = "slug";

    private final CatalogQueries queries;

    @Override
    public List<SourceDescriptor<?>> getQuerylist(RequestContext request) {
        String slug = request.getPathVariable(PLAY_PATH_VARIABLE);
        if (slug == null || slug.isBlank()) {
            throw new MissingSlugException("Missing play slug in path");
        }
        String title = slug.replace('-', ' ');

        return List.of(
                SourceDescriptor.of(queries.plays().filter(play -> title.equals(play.getTitle())), new PlaySerializer()),
                SourceDescriptor.of(queries.sonnets(), new PoemSerializer()));
    }
}
