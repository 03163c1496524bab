package io.ringsub.store.impl;

import io.ringsub.exceptions.StoreException;
import io.ringsub.exceptions.StoreObjectExistsException;
import io.ringsub.store.StoreGateway;
import io.ringsub.store.query.RawQuery;
import io.ringsub.store.query.StoreRow;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link StoreGateway} over plain JDBC. The provider name is the JDBC driver class and the
 * connection string is the JDBC URL. Each operation borrows its own connection from
 * {@link DriverManager} and closes it before returning.
 */
@Slf4j
public final class JdbcStoreGateway implements StoreGateway {

    /* 42S01: ANSI / H2 / MySQL, 42P07: PostgreSQL, X0Y32: Derby. */
    private static final Set<String> OBJECT_EXISTS_SQL_STATES = Set.of("42S01", "42P07", "X0Y32");

    private final String providerName;
    private final String connectionString;

    private final Map<String, ParsedSql> parsedCache = new ConcurrentHashMap<>();

    public JdbcStoreGateway(final String providerName, final String connectionString) {
        this.providerName = Objects.requireNonNull(providerName, "providerName");
        this.connectionString = Objects.requireNonNull(connectionString, "connectionString");

        try {
            Class.forName(providerName);
        } catch (final ClassNotFoundException e) {
            throw new StoreException("JDBC driver class not found: " + providerName, e);
        }
    }

    @Override
    public int executeScalar(final RawQuery query) {
        try (final Connection conn = connect();
             final PreparedStatement ps = prepare(conn, query);
             final ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return 0;

            final Object value = rs.getObject(1);
            if (value == null) return 0;
            if (value instanceof Number n) return n.intValue();
            if (value instanceof Boolean b) return b ? 1 : 0;

            throw new StoreException("Scalar query returned a non-numeric value of type "
                    + value.getClass().getName());
        } catch (final SQLException e) {
            throw translate(e, query);
        }
    }

    @Override
    public void execute(final RawQuery query) {
        try (final Connection conn = connect();
             final PreparedStatement ps = prepare(conn, query)) {
            ps.execute();
        } catch (final SQLException e) {
            throw translate(e, query);
        }
    }

    @Override
    public List<StoreRow> executeTabular(final RawQuery query) {
        try (final Connection conn = connect();
             final PreparedStatement ps = prepare(conn, query);
             final ResultSet rs = ps.executeQuery()) {
            final ResultSetMetaData meta = rs.getMetaData();
            final int columnCount = meta.getColumnCount();
            final List<StoreRow> rows = new ArrayList<>();

            while (rs.next()) {
                final Map<String, Object> columns = new LinkedHashMap<>(columnCount);
                for (int c = 1; c <= columnCount; c++) {
                    columns.put(meta.getColumnLabel(c), rs.getObject(c));
                }
                rows.add(new StoreRow(columns));
            }
            return rows;
        } catch (final SQLException e) {
            throw translate(e, query);
        }
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(connectionString);
    }

    private PreparedStatement prepare(final Connection conn, final RawQuery query) throws SQLException {
        final ParsedSql parsed = parsedCache.computeIfAbsent(query.getSql(), ParsedSql::parse);
        final Map<String, Object> values = query.getParameters();

        log.debug("Executing {} with {}", parsed.jdbcSql(), values);

        final PreparedStatement ps = conn.prepareStatement(parsed.jdbcSql());
        try {
            final List<String> names = parsed.parameterNames();
            for (int i = 0; i < names.size(); i++) {
                final String name = names.get(i);
                if (!values.containsKey(name)) {
                    throw new StoreException("No value bound for parameter :" + name);
                }
                ps.setObject(i + 1, values.get(name));
            }
            return ps;
        } catch (final SQLException | RuntimeException e) {
            ps.close();
            throw e;
        }
    }

    private StoreException translate(final SQLException e, final RawQuery query) {
        if (OBJECT_EXISTS_SQL_STATES.contains(e.getSQLState())) {
            return new StoreObjectExistsException(e.getMessage(), e);
        }
        return new StoreException("Store operation failed [" + e.getSQLState() + "]: " + query.getSql(), e);
    }

    /**
     * Query text with {@code :Name} placeholders rewritten to JDBC {@code ?} markers, plus the
     * parameter names in marker order. Quoted literals and {@code ::} casts are left alone.
     */
    record ParsedSql(String jdbcSql, List<String> parameterNames) {

        static ParsedSql parse(final String sql) {
            final StringBuilder out = new StringBuilder(sql.length());
            final List<String> names = new ArrayList<>();
            boolean inSingle = false;
            boolean inDouble = false;

            int i = 0;
            while (i < sql.length()) {
                final char ch = sql.charAt(i);

                if (ch == '\'' && !inDouble) {
                    inSingle = !inSingle;
                } else if (ch == '"' && !inSingle) {
                    inDouble = !inDouble;
                } else if (ch == ':' && !inSingle && !inDouble) {
                    if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
                        out.append("::");
                        i += 2;
                        continue;
                    }
                    if (i + 1 < sql.length() && Character.isJavaIdentifierStart(sql.charAt(i + 1))) {
                        int end = i + 1;
                        while (end < sql.length() && Character.isJavaIdentifierPart(sql.charAt(end))) {
                            end++;
                        }
                        names.add(sql.substring(i + 1, end));
                        out.append('?');
                        i = end;
                        continue;
                    }
                }

                out.append(ch);
                i++;
            }
            return new ParsedSql(out.toString(), List.copyOf(names));
        }
    }
}
