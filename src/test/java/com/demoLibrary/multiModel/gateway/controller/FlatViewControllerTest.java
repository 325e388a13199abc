package com.demoLibrary.multiModel.gateway.controller;

import com.demoLibrary.multiModel.aggregate.cache.CaffeineQueryCache;
import com.demoLibrary.multiModel.aggregate.model.SourceDescriptor;
import com.demoLibrary.multiModel.aggregate.query.RecordSerializer;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import com.demoLibrary.multiModel.catalog.model.Play;
import com.demoLibrary.multiModel.catalog.view.CatalogQueries;
import com.demoLibrary.multiModel.repository.CatalogRepository;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class FlatViewControllerTest {

    @TestConfiguration
    static class FailingViewConfig {

        @Bean("catalog-failing-serializer")
        FlatMultipleModelView failingSerializerView(CatalogQueries queries) {
            return new FailingSerializerView(queries);
        }
    }

    static class FailingSerializerView extends FlatMultipleModelView {
        FailingSerializerView(CatalogQueries queries) {
            this.querylist = List.of(SourceDescriptor.of(queries.plays(), new FailingPlaySerializer()));
        }
    }

    static class FailingPlaySerializer implements RecordSerializer<Play> {
        @Override
        public Document serialize(Play play) {
            throw new IllegalArgumentException("cannot serialize play " + play.getId());
        }

        @Override
        public List<String> getFieldNames() {
            return List.of("title");
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CatalogRepository catalogRepository;

    @Autowired
    private CaffeineQueryCache queryCache;

    @BeforeEach
    void setUp() {
        queryCache.invalidateAll();
        catalogRepository.resetQueryCount();
    }

    @Test
    void getReturnsFlatLabelledArray() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(6)))
                .andExpect(jsonPath("$[0].title").value("Romeo And Juliet"))
                .andExpect(jsonPath("$[0].year").value(1597))
                .andExpect(jsonPath("$[0].type").value("Play"))
                .andExpect(jsonPath("$[5].title").value("As a decrepit father takes delight"))
                .andExpect(jsonPath("$[5].type").value("Poem"))
                .andExpect(jsonPath("$[5].year").doesNotExist());

        assertThat(catalogRepository.getQueryCount()).isEqualTo(2);
    }

    @Test
    void postPutDeleteAreNotAllowed() throws Exception {
        mockMvc.perform(post("/api/v1/flat/catalog").contentType(MediaType.APPLICATION_JSON).content("{\"fake\": \"data\"}"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.detail").value("Method \"POST\" not allowed."));
        mockMvc.perform(put("/api/v1/flat/catalog").contentType(MediaType.APPLICATION_JSON).content("{\"fake\": \"data\"}"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.detail").value("Method \"PUT\" not allowed."));
        mockMvc.perform(delete("/api/v1/flat/catalog"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.detail").value("Method \"DELETE\" not allowed."));

        assertThat(catalogRepository.getQueryCount()).isZero();
    }

    @Test
    void sortParameterOrdersAcrossSources() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog").param("o", "-title"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].title").value("Shall I compare thee to a summer's day?"))
                .andExpect(jsonPath("$[5].title").value("A Midsummer Night's Dream"));
    }

    @Test
    void sortingByFieldMissingOnSomeRecordsIsRejected() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog").param("o", "year"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_SORTING_FIELD"))
                .andExpect(jsonPath("$.message").value("Invalid sorting field: year"));
    }

    @Test
    void labelledViewUsesCustomLabels() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog-labelled"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].title").value("A Midsummer Night's Dream"))
                .andExpect(jsonPath("$[0].type").value("Drama"))
                .andExpect(jsonPath("$[2].type").value("Poetry"));
    }

    @Test
    void slugSelectsThePlay() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog-by-play/Julius-Caesar"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].title").value("Julius Caesar"));
    }

    @Test
    void playViewWithoutSlugIsABadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog-by-play"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void searchAndLetterFilters() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog-search").param("search", "as"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].title").value("As You Like It"))
                .andExpect(jsonPath("$[1].title").value("As a decrepit father takes delight"));

        mockMvc.perform(get("/api/v1/flat/catalog-without-letter").param("letter", "o"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(4)))
                .andExpect(jsonPath("$[0].title").value("A Midsummer Night's Dream"));
    }

    @Test
    void cachedViewSkipsTheRepositoryOnRepeat() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog-cached")).andExpect(status().isOk());
        assertThat(catalogRepository.getQueryCount()).isEqualTo(2);

        mockMvc.perform(get("/api/v1/flat/catalog-cached"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(6)));
        assertThat(catalogRepository.getQueryCount()).isEqualTo(2);
    }

    @Test
    void limitWrapsResultsInAPage() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog").param("limit", "2").param("offset", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(6))
                .andExpect(jsonPath("$.limit").value(2))
                .andExpect(jsonPath("$.offset").value(1))
                .andExpect(jsonPath("$.results", hasSize(2)))
                .andExpect(jsonPath("$.results[0].title").value("A Midsummer Night's Dream"));
    }

    @Test
    void invalidLimitIsRejected() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownViewIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/flat/novels"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNKNOWN_VIEW"));
    }

    @Test
    void correlationIdIsEchoed() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog").header("X-Correlation-ID", "abc-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-ID", "abc-123"));
    }

    @Test
    void serializerFailureIsAServerError() throws Exception {
        mockMvc.perform(get("/api/v1/flat/catalog-failing-serializer"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value(not(containsString("cannot serialize"))));
    }
}
