package com.demoLibrary.multiModel.aggregate.filter;

import com.demoLibrary.multiModel.aggregate.model.RequestContext;
import com.demoLibrary.multiModel.aggregate.query.EntityQuery;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import com.demoLibrary.multiModel.catalog.model.Play;
import com.demoLibrary.multiModel.catalog.model.Poem;
import com.demoLibrary.multiModel.catalog.view.CatalogQueries;
import com.demoLibrary.multiModel.repository.CatalogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SearchFilterBackendTest {

    private final SearchFilterBackend backend = new SearchFilterBackend(new ObjectMapper());
    private final CatalogQueries queries = new CatalogQueries(new CatalogRepository());

    private static RequestContext search(String value) {
        return RequestContext.builder().correlationId("test").queryParams(Map.of("search", value)).build();
    }

    private static List<String> playTitles(EntityQuery<Play> query) {
        return query.fetch().stream().map(Play::getTitle).toList();
    }

    @Test
    void matchesCaseInsensitively() {
        SearchView view = new SearchView(List.of("title"));

        EntityQuery<Play> result = backend.filterQueryset(queries.plays(), search("JULIUS"), view);

        assertThat(playTitles(result)).containsExactly("Julius Caesar");
    }

    @Test
    void everyTermMustMatchSomeField() {
        SearchView view = new SearchView(List.of("title", "genre"));

        EntityQuery<Play> result = backend.filterQueryset(queries.plays(), search("tragedy, romeo"), view);

        assertThat(playTitles(result)).containsExactly("Romeo And Juliet");
    }

    @Test
    void absentFieldNeverMatches() {
        SearchView view = new SearchView(List.of("genre"));

        EntityQuery<Poem> result = backend.filterQueryset(queries.poems(), search("sonnet"), view);

        assertThat(result.fetch()).isEmpty();
    }

    @Test
    void blankSearchOrNoFieldsLeavesQueryUntouched() {
        EntityQuery<Play> plays = queries.plays();

        assertThat(backend.filterQueryset(plays, search("  "), new SearchView(List.of("title")))).isSameAs(plays);
        assertThat(backend.filterQueryset(plays, search("romeo"), new SearchView(List.of()))).isSameAs(plays);
        assertThat(backend.filterQueryset(plays, RequestContext.builder().build(), new SearchView(List.of("title"))))
                .isSameAs(plays);
    }

    @Test
    void termsSplitOnWhitespaceAndCommas() {
        assertThat(backend.searchTerms(search(" As,  you\tLike "))).containsExactly("as", "you", "like");
    }

    static class SearchView extends FlatMultipleModelView {
        SearchView(List<String> fields) {
            this.searchFields = fields;
        }
    }
}
