package io.ringsub.store.query;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One row of a tabular result. Column lookup ignores case, since stores disagree on
 * how they fold unquoted identifiers.
 */
public record StoreRow(Map<String, Object> columns) {
    public StoreRow(final Map<String, Object> columns) {
        final Map<String, Object> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(columns);
        this.columns = Collections.unmodifiableMap(copy);
    }

    public Object get(final String column) {
        if (!columns.containsKey(column)) {
            throw new IllegalArgumentException("No column named " + column);
        }
        return columns.get(column);
    }

    public String getString(final String column) {
        final Object value = get(column);
        return value == null ? null : value.toString();
    }
}
