package com.supplyradar.supply;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values of one batch read keyed by query name, in query order. Every submitted query has an entry.
 */
public record QueryResult(Map<String, QueryValue> values) {

    public QueryResult {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public QueryValue get(String name) {
        QueryValue value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown query: " + name);
        }
        return value;
    }

    public boolean isComplete() {
        return values.values().stream().noneMatch(QueryValue::isUnavailable);
    }

    public long unavailableCount() {
        return values.values().stream().filter(QueryValue::isUnavailable).count();
    }
}
