package org.carball.sqlinspector.execution;

import lombok.extern.slf4j.Slf4j;
import org.carball.sqlinspector.analyzer.SqlFormatter;
import org.carball.sqlinspector.exception.QueryExecutionException;
import org.carball.sqlinspector.model.execution.QueryResultSet;
import org.carball.sqlinspector.model.query.QueryParameters;
import org.carball.sqlinspector.parser.SqlPlaceholders;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Re-runs verified statements over plain JDBC.
 */
@Slf4j
public class JdbcQueryExecutor implements QueryExecutor {

    static final int DEFAULT_MAX_ROWS = 1000;

    private final String connectionString;
    private final int maxRows;
    private volatile String databaseProduct;

    public JdbcQueryExecutor(String connectionString) {
        this(connectionString, DEFAULT_MAX_ROWS);
    }

    public JdbcQueryExecutor(String connectionString, int maxRows) {
        if (connectionString == null || connectionString.isBlank()) {
            throw new IllegalArgumentException("JDBC connection string must not be empty");
        }
        this.connectionString = connectionString;
        this.maxRows = maxRows;
    }

    @Override
    public QueryResultSet execute(String statement, QueryParameters parameters) {
        BoundStatement bound = bind(statement, parameters);
        long started = System.nanoTime();

        try (Connection conn = DriverManager.getConnection(connectionString);
             PreparedStatement stmt = conn.prepareStatement(bound.sql())) {

            stmt.setMaxRows(maxRows);
            for (int i = 0; i < bound.values().size(); i++) {
                stmt.setObject(i + 1, bound.values().get(i));
            }

            try (ResultSet rs = stmt.executeQuery()) {
                ResultSetMetaData metaData = rs.getMetaData();
                int columnCount = metaData.getColumnCount();

                List<String> headers = new ArrayList<>(columnCount);
                for (int column = 1; column <= columnCount; column++) {
                    headers.add(metaData.getColumnLabel(column));
                }

                List<List<Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    List<Object> row = new ArrayList<>(columnCount);
                    for (int column = 1; column <= columnCount; column++) {
                        row.add(rs.getObject(column));
                    }
                    rows.add(row);
                }

                double durationMs = (System.nanoTime() - started) / 1_000_000.0;
                log.debug("Re-executed statement in {} ms, {} rows", durationMs, rows.size());
                return new QueryResultSet(headers, rows, SqlFormatter.format(statement, parameters), durationMs);
            }
        } catch (SQLException e) {
            log.error("Failed to re-execute statement: {}", e.getMessage());
            throw new QueryExecutionException("Statement execution failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String databaseProduct() {
        String product = databaseProduct;
        if (product == null) {
            try (Connection conn = DriverManager.getConnection(connectionString)) {
                product = conn.getMetaData().getDatabaseProductName();
                databaseProduct = product;
            } catch (SQLException e) {
                throw new QueryExecutionException("Could not determine database product: " + e.getMessage(), e);
            }
        }
        return product;
    }

    /**
     * Turns named placeholders into positional ones, collecting values in placeholder order.
     */
    static BoundStatement bind(String statement, QueryParameters parameters) {
        if (parameters == null || !parameters.isNamed()) {
            List<Object> values = parameters == null ? List.of() : parameters.getPositional();
            return new BoundStatement(statement, values);
        }

        Map<String, Object> named = parameters.getNamed();
        List<Object> values = new ArrayList<>();
        String sql = SqlPlaceholders.replace(statement, index -> null, name -> {
            if (!named.containsKey(name)) {
                throw new QueryExecutionException("Statement references unbound parameter :" + name);
            }
            values.add(named.get(name));
            return "?";
        });
        return new BoundStatement(sql, values);
    }

    record BoundStatement(String sql, List<Object> values) {
    }
}
