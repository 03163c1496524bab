package io.ringsub.store.query;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A query text plus its named bind values. Placeholders in the text are written as
 * {@code :Name} and are bound by name, so the same parameter may appear more than once.
 */
@Getter
@ToString
public final class RawQuery {
    private final String sql;
    private final Map<String, Object> parameters = new LinkedHashMap<>();

    private RawQuery(final String sql) {
        this.sql = Objects.requireNonNull(sql, "sql");
    }

    public static RawQuery create(final String sql) {
        return new RawQuery(sql);
    }

    public RawQuery addParameterValue(final String name, final Object value) {
        Objects.requireNonNull(name, "name");
        parameters.put(name, value);
        return this;
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }
}
