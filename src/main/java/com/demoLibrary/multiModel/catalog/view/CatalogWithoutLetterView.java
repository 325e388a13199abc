package com.demoLibrary.multiModel.catalog.view;

import com.demoLibrary.multiModel.aggregate.model.RequestContext;
import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import com.demoLibrary.multiModel.aggregate.query.EntityQuery;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import com.demoLibrary.multiModel.catalog.model.Play;
import com.demoLibrary.multiModel.catalog.serializer.PlaySerializer;
import com.demoLibrary.multiModel.catalog.serializer.PoemSerializer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Plays whose title does not contain {@code ?letter=}, followed by all sonnets.
 * The letter only narrows the plays.
 */
@Component("catalog-without-letter")
public class CatalogWithoutLetterView extends FlatMultipleModelView {

    public static final String LETTER_PARAM = "letter";

    public CatalogWithoutLetterView(CatalogQueries queries) {
        this.querylist = List.of(
                SourceDescriptor.of(queries.plays(), new PlaySerializer())
                        .withFilterFn(CatalogWithoutLetterView::titleWithoutLetter),
                SourceDescriptor.of(queries.sonnets(), new PoemSerializer()));
    }

    static EntityQuery<Play> titleWithoutLetter(EntityQuery<Play> query, RequestContext request) {
        String letter = request.getQueryParam(LETTER_PARAM);
        if (letter == null || letter.isEmpty()) {
            return query;
        }
        String excluded = letter.toLowerCase(Locale.ROOT);
        return query.exclude(play -> play.getTitle() != null
                && play.getTitle().toLowerCase(Locale.ROOT).contains(excluded));
    }
}
