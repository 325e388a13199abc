package com.demoLibrary.multiModel.catalog.serializer;

import com.demoLibrary.multiModel.aggregate.query.RecordSerializer;
import com.demoLibrary.multiModel.catalog.model.Poem;
import org.bson.Document;

import java.util.List;

public class PoemSerializer implements RecordSerializer<Poem> {

    private static final List<String> FIELDS = List.of("title", "style");

    @Override
    public Document serialize(Poem poem) {
        return new Document("title", poem.getTitle())
                .append("style", poem.getStyle());
    }

    @Override
    public List<String> getFieldNames() {
        return FIELDS;
    }
}
