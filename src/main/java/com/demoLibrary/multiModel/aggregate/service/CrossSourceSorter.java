package com.demoLibrary.multiModel.aggregate.service;

import com.demoLibrary.multiModel.aggregate.exception.IncomparableSortValuesException;
import com.demoLibrary.multiModel.aggregate.exception.MissingSortFieldException;
import com.demoLibrary.multiModel.aggregate.model.SortingField;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders a flattened record sequence by one or more fields.
 * 
 * Every record must carry every sort field; otherwise the whole sort fails.
 * Numbers compare numerically regardless of their boxed type, other values must be
 * {@link Comparable} instances of the same class. The sort is stable.
 */
@Slf4j
@Service
public class CrossSourceSorter {

    public List<Document> sort(List<Document> records, List<SortingField> sortingFields) {
        if (sortingFields == null || sortingFields.isEmpty()) {
            return records;
        }

        // Keys are extracted and checked up front so a bad value fails before any reordering,
        // whatever the number of records.
        Map<Document, List<Object>> keys = new IdentityHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            Document record = records.get(i);
            List<Object> recordKeys = new ArrayList<>(sortingFields.size());
            for (SortingField sortingField : sortingFields) {
                Object value = extract(record, sortingField, i);
                requireSortable(value, sortingField);
                recordKeys.add(value);
            }
            keys.put(record, recordKeys);
        }

        Comparator<Document> comparator = null;
        for (int f = 0; f < sortingFields.size(); f++) {
            int index = f;
            SortingField sortingField = sortingFields.get(f);
            Comparator<Document> byField = (a, b) ->
                    compareValues(keys.get(a).get(index), keys.get(b).get(index), sortingField);
            if (sortingField.isDescending()) {
                byField = byField.reversed();
            }
            comparator = comparator == null ? byField : comparator.thenComparing(byField);
        }

        List<Document> sorted = new ArrayList<>(records);
        sorted.sort(comparator);
        log.debug("Sorted {} records by {}", sorted.size(), sortingFields);
        return sorted;
    }

    private Object extract(Document record, SortingField sortingField, int recordIndex) {
        Object current = record;
        List<String> walked = new ArrayList<>();
        for (String segment : sortingField.getPath()) {
            walked.add(segment);
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                throw new MissingSortFieldException(String.join(".", walked), recordIndex);
            }
            current = map.get(segment);
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    int compareValues(Object a, Object b, SortingField sortingField) {
        if (a instanceof Number na && b instanceof Number nb) {
            return compareNumbers(na, nb);
        }
        if (a.getClass() != b.getClass() || !(a instanceof Comparable)) {
            throw new IncomparableSortValuesException("Cannot compare values of types "
                    + a.getClass().getSimpleName() + " and " + b.getClass().getSimpleName()
                    + " on sorting field: " + sortingField.getField());
        }
        return ((Comparable<Object>) a).compareTo(b);
    }

    private void requireSortable(Object value, SortingField sortingField) {
        if (value == null) {
            throw new IncomparableSortValuesException("Cannot sort on null value of field: " + sortingField.getField());
        }
        if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
            throw new IncomparableSortValuesException("Cannot sort on list or map attribute: " + sortingField.getField());
        }
    }

    private int compareNumbers(Number a, Number b) {
        if (isFloating(a) || isFloating(b)) {
            double da = a.doubleValue();
            double db = b.doubleValue();
            if (!Double.isFinite(da) || !Double.isFinite(db)) {
                return Double.compare(da, db);
            }
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    private boolean isFloating(Number number) {
        return number instanceof Double || number instanceof Float;
    }

    private BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal bigDecimal) {
            return bigDecimal;
        }
        if (number instanceof BigInteger bigInteger) {
            return new BigDecimal(bigInteger);
        }
        if (isFloating(number)) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
