package com.demoLibrary.multiModel.aggregate.filter;

import com.demoLibrary.multiModel.aggregate.model.RequestContext;
import com.demoLibrary.multiModel.aggregate.query.EntityQuery;
import com.demoLibrary.multiModel.aggregate.query.FilterBackend;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive "contains" search over the view's search fields.
 * 
 * The {@code search} parameter is split on whitespace and commas; every term has to
 * occur in at least one search field of an entity for the entity to be kept.
 * Entities without a given field simply do not match on it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchFilterBackend implements FilterBackend {

    public static final String SEARCH_PARAM = "search";
    private static final Pattern TERM_SEPARATOR = Pattern.compile("[\\s,]+");

    private final ObjectMapper objectMapper;

    @Override
    public <T> EntityQuery<T> filterQueryset(EntityQuery<T> query, RequestContext request, FlatMultipleModelView view) {
        List<String> terms = searchTerms(request);
        List<String> fields = view.getSearchFields();
        if (terms.isEmpty() || fields.isEmpty()) {
            return query;
        }

        log.debug("Applying search - correlationId: {}, model: {}, terms: {}, fields: {}",
                request.getCorrelationId(), query.getModelName(), terms, fields);
        return query.filter(entity -> matchesAllTerms(objectMapper.valueToTree(entity), terms, fields));
    }

    List<String> searchTerms(RequestContext request) {
        String raw = request.getQueryParam(SEARCH_PARAM);
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(TERM_SEPARATOR.split(raw.trim()))
                .filter(term -> !term.isEmpty())
                .map(term -> term.toLowerCase(Locale.ROOT))
                .toList();
    }

    private boolean matchesAllTerms(JsonNode entity, List<String> terms, List<String> fields) {
        for (String term : terms) {
            boolean matched = fields.stream().anyMatch(field -> fieldContains(entity, field, term));
            if (!matched) {
                return false;
            }
        }
        return true;
    }

    private boolean fieldContains(JsonNode entity, String field, String term) {
        JsonNode value = entity.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return false;
        }
        return value.asText().toLowerCase(Locale.ROOT).contains(term);
    }
}
