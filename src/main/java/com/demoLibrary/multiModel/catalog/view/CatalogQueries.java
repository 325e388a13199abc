package com.demoLibrary.multiModel.catalog.view;

import com.demoLibrary.multiModel.catalog.model.Play;
import com.demoLibrary.multiModel.catalog.model.Poem;
import com.demoLibrary.multiModel.repository.CatalogRepository;
import com.demoLibrary.multiModel.repository.RepositoryQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Base queries shared by the catalog views.
 */
@Component
@RequiredArgsConstructor
public class CatalogQueries {

    public static final String SONNET = "Sonnet";

    private final CatalogRepository repository;

    public RepositoryQuery<Play> plays() {
        return repository.query("plays", Play.class);
    }

    public RepositoryQuery<Poem> poems() {
        return repository.query("poems", Poem.class);
    }

    public RepositoryQuery<Poem> sonnets() {
        return poems().filter(poem -> SONNET.equals(poem.getStyle()));
    }
}
