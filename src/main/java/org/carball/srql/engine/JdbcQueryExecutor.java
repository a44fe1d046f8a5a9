package org.carball.srql.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.srql.compiler.CompiledQuery;
import org.carball.srql.error.QueryExecutionException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs compiled queries over JDBC. {@code $n} placeholders are rewritten to {@code ?} and the
 * parameters reordered to match, so it works with either placeholder style.
 */
@Slf4j
public class JdbcQueryExecutor implements QueryExecutor {

    private final ConnectionSource connections;

    public JdbcQueryExecutor(String jdbcUrl) {
        this(() -> DriverManager.getConnection(jdbcUrl));
    }

    public JdbcQueryExecutor(DataSource dataSource) {
        this(dataSource::getConnection);
    }

    JdbcQueryExecutor(ConnectionSource connections) {
        this.connections = connections;
    }

    @Override
    public List<Map<String, Object>> execute(CompiledQuery query) throws QueryExecutionException {
        JdbcStatement statement = toJdbc(query.getSql(), query.getParams());
        List<Map<String, Object>> rows = new ArrayList<>();

        try (Connection conn = connections.open();
             PreparedStatement stmt = conn.prepareStatement(statement.sql())) {

            for (int i = 0; i < statement.params().size(); i++) {
                stmt.setObject(i + 1, toJdbcValue(statement.params().get(i)));
            }

            try (ResultSet rs = stmt.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                int columns = meta.getColumnCount();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int c = 1; c <= columns; c++) {
                        row.put(meta.getColumnLabel(c), fromJdbcValue(rs.getObject(c)));
                    }
                    rows.add(row);
                }
            }
        } catch (SQLException e) {
            log.error("Query execution failed: {}", e.getMessage());
            throw new QueryExecutionException("query execution failed: " + e.getMessage(), e);
        }

        log.debug("Fetched {} rows with {} parameters", rows.size(), statement.params().size());
        return rows;
    }

    /**
     * Rewrites {@code $n} placeholders outside string literals to {@code ?}, ordering the
     * parameters by placeholder occurrence. {@code ?} placeholders pass through unchanged.
     */
    static JdbcStatement toJdbc(String sql, List<Object> params) {
        StringBuilder out = new StringBuilder(sql.length());
        List<Object> ordered = new ArrayList<>();
        boolean numbered = false;
        boolean inLiteral = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'') {
                inLiteral = !inLiteral;
            } else if (!inLiteral && c == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
                int j = i + 1;
                while (j < sql.length() && Character.isDigit(sql.charAt(j))) {
                    j++;
                }
                int index = Integer.parseInt(sql.substring(i + 1, j));
                if (index < 1 || index > params.size()) {
                    throw new IllegalArgumentException("Placeholder $" + index + " has no parameter");
                }
                ordered.add(params.get(index - 1));
                out.append('?');
                numbered = true;
                i = j - 1;
                continue;
            }
            out.append(c);
        }
        return new JdbcStatement(out.toString(), numbered ? ordered : List.copyOf(params));
    }

    private static Object toJdbcValue(Object value) {
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        return value;
    }

    private static Object fromJdbcValue(Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        return value;
    }

    record JdbcStatement(String sql, List<Object> params) {
    }

    @FunctionalInterface
    interface ConnectionSource {
        Connection open() throws SQLException;
    }
}
