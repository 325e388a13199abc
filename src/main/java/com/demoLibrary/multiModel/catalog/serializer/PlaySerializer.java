package com.demoLibrary.multiModel.catalog.serializer;

import com.demoLibrary.multiModel.aggregate.query.RecordSerializer;
import com.demoLibrary.multiModel.catalog.model.Play;
import org.bson.Document;

import java.util.List;

public class PlaySerializer implements RecordSerializer<Play> {

    private static final List<String> FIELDS = List.of("genre", "title", "year");

    @Override
    public Document serialize(Play play) {
        return new Document("genre", play.getGenre())
                .append("title", play.getTitle())
                .append("year", play.getYear());
    }

    @Override
    public List<String> getFieldNames() {
        return FIELDS;
    }
}
