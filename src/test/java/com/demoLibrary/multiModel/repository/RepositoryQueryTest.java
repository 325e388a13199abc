package com.demoLibrary.multiModel.repository;

import com.demoLibrary.multiModel.catalog.model.Play;
import com.demoLibrary.multiModel.catalog.model.Poem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepositoryQueryTest {

    private CatalogRepository repository;

    @BeforeEach
    void setUp() {
        repository = new CatalogRepository();
    }

    private static List<String> titles(List<Play> plays) {
        return plays.stream().map(Play::getTitle).toList();
    }

    @Test
    void narrowingDoesNotTouchTheStore() {
        RepositoryQuery<Play> query = repository.query("plays", Play.class)
                .filter(play -> play.getYear() > 1597)
                .exclude(play -> "Comedy".equals(play.getGenre()));

        assertThat(repository.getQueryCount()).isZero();
        assertThat(query.isEvaluated()).isFalse();
        assertThat(titles(query.fetch())).containsExactly("Julius Caesar");
        assertThat(repository.getQueryCount()).isEqualTo(1);
    }

    @Test
    void fetchIsMemoized() {
        RepositoryQuery<Play> query = repository.query("plays", Play.class);

        List<Play> first = query.fetch();
        List<Play> second = query.fetch();

        assertThat(second).isSameAs(first).hasSize(4);
        assertThat(repository.getQueryCount()).isEqualTo(1);
    }

    @Test
    void allReturnsAFreshUnevaluatedCopyKeepingFilters() {
        RepositoryQuery<Poem> sonnets = repository.query("poems", Poem.class)
                .filter(poem -> "Sonnet".equals(poem.getStyle()));
        sonnets.fetch();

        RepositoryQuery<Poem> copy = sonnets.all();

        assertThat(copy.isEvaluated()).isFalse();
        assertThat(copy.fetch()).hasSize(2);
        assertThat(repository.getQueryCount()).isEqualTo(2);
    }

    @Test
    void narrowingAnEvaluatedQueryFiltersInMemory() {
        RepositoryQuery<Play> plays = repository.query("plays", Play.class);
        plays.fetch();

        RepositoryQuery<Play> tragedies = plays.filter(play -> "Tragedy".equals(play.getGenre()));
        RepositoryQuery<Play> earlyTragedies = tragedies.filter(play -> play.getYear() < 1600);

        assertThat(titles(tragedies.fetch())).containsExactly("Romeo And Juliet", "Julius Caesar");
        assertThat(titles(earlyTragedies.fetch())).containsExactly("Romeo And Juliet");
        assertThat(earlyTragedies.count()).isEqualTo(1);
        assertThat(repository.getQueryCount()).isEqualTo(1);
    }

    @Test
    void countRunsOneQueryUnlessEvaluated() {
        RepositoryQuery<Play> plays = repository.query("plays", Play.class);

        assertThat(plays.count()).isEqualTo(4);
        assertThat(repository.getQueryCount()).isEqualTo(1);

        plays.fetch();
        assertThat(plays.count()).isEqualTo(4);
        assertThat(repository.getQueryCount()).isEqualTo(2);
    }

    @Test
    void modelNameIsTheEntityClassName() {
        assertThat(repository.query("plays", Play.class).getModelName()).isEqualTo("Play");
        assertThat(repository.query("poems", Poem.class).getModelName()).isEqualTo("Poem");
    }

    @Test
    void unknownCollectionIsRejected() {
        assertThatThrownBy(() -> repository.query("novels", Play.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown collection: novels");
    }
}
