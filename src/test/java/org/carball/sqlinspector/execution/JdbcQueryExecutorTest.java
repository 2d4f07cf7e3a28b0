package org.carball.sqlinspector.execution;

import org.carball.sqlinspector.exception.QueryExecutionException;
import org.carball.sqlinspector.model.execution.QueryResultSet;
import org.carball.sqlinspector.model.query.QueryParameters;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcQueryExecutorTest {

    private static final String JDBC_URL = "jdbc:h2:mem:executor_test;DB_CLOSE_DELAY=-1";

    private JdbcQueryExecutor executor;

    @BeforeEach
    void setUp() throws SQLException {
        try (Connection conn = DriverManager.getConnection(JDBC_URL);
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE customers (id INT PRIMARY KEY, name VARCHAR(50), region VARCHAR(20))");
            stmt.execute("INSERT INTO customers VALUES (1, 'Ada', 'EU'), (2, 'Grace', 'US'), (3, 'Linus', 'EU'), (4, 'Nobody', NULL)");
        }
        executor = new JdbcQueryExecutor(JDBC_URL);
    }

    @AfterEach
    void tearDown() throws SQLException {
        try (Connection conn = DriverManager.getConnection(JDBC_URL);
             Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE customers");
        }
    }

    @Test
    void shouldExecuteWithPositionalParameters() {
        // When
        QueryResultSet resultSet = executor.execute(
                "SELECT id, name FROM customers WHERE region = ? ORDER BY id",
                QueryParameters.positional("EU"));

        // Then
        assertThat(resultSet.headers()).containsExactly("ID", "NAME");
        assertThat(resultSet.rowCount()).isEqualTo(2);
        assertThat(resultSet.rows().get(0)).containsExactly(1, "Ada");
        assertThat(resultSet.rows().get(1)).containsExactly(3, "Linus");
        assertThat(resultSet.sql()).isEqualTo("SELECT id, name FROM customers WHERE region = 'EU' ORDER BY id");
        assertThat(resultSet.durationMs()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void shouldExecuteWithNamedParameters() {
        // Given
        Map<String, Object> named = new LinkedHashMap<>();
        named.put("low", 2);
        named.put("high", 3);

        // When
        QueryResultSet resultSet = executor.execute(
                "SELECT name FROM customers WHERE id BETWEEN :low AND :high ORDER BY id",
                QueryParameters.named(named));

        // Then
        assertThat(resultSet.rows()).extracting(row -> row.get(0)).containsExactly("Grace", "Linus");
    }

    @Test
    void shouldNotInterpretParameterValuesAsSql() {
        // When
        QueryResultSet resultSet = executor.execute(
                "SELECT id FROM customers WHERE name = ?",
                QueryParameters.positional("x' OR '1'='1"));

        // Then
        assertThat(resultSet.rows()).isEmpty();
    }

    @Test
    void shouldReturnSqlNullsAsNull() {
        // When
        QueryResultSet resultSet = executor.execute(
                "SELECT region FROM customers WHERE id = ?", QueryParameters.positional(4));

        // Then
        assertThat(resultSet.rows()).hasSize(1);
        assertThat(resultSet.rows().get(0)).containsExactly((Object) null);
    }

    @Test
    void shouldLimitReturnedRows() {
        // Given
        JdbcQueryExecutor limited = new JdbcQueryExecutor(JDBC_URL, 2);

        // When
        QueryResultSet resultSet = limited.execute("SELECT id FROM customers WHERE id > ?", QueryParameters.positional(0));

        // Then
        assertThat(resultSet.rowCount()).isEqualTo(2);
    }

    @Test
    void shouldWrapDriverFailures() {
        assertThatThrownBy(() -> executor.execute("SELECT * FROM missing_table WHERE id = ?", QueryParameters.positional(1)))
                .isInstanceOfSatisfying(QueryExecutionException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(500))
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    void shouldReportDatabaseProduct() {
        assertThat(executor.databaseProduct()).isEqualTo("H2");
    }

    @Test
    void shouldBindNamedPlaceholdersInOrderOfAppearance() {
        // Given
        Map<String, Object> named = new LinkedHashMap<>();
        named.put("b", "second");
        named.put("a", "first");

        // When
        JdbcQueryExecutor.BoundStatement bound = JdbcQueryExecutor.bind(
                "SELECT * FROM t WHERE x = :a AND y = :b AND z = :a", QueryParameters.named(named));

        // Then
        assertThat(bound.sql()).isEqualTo("SELECT * FROM t WHERE x = ? AND y = ? AND z = ?");
        assertThat(bound.values()).containsExactly("first", "second", "first");
    }

    @Test
    void shouldRejectUnboundNamedPlaceholder() {
        assertThatThrownBy(() -> JdbcQueryExecutor.bind("SELECT :missing", QueryParameters.named(Map.of("other", 1))))
                .isInstanceOfSatisfying(QueryExecutionException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(500))
                .hasMessageContaining(":missing");
    }

    @Test
    void shouldReportUnboundNamedPlaceholderAsExecutionFailure() {
        assertThatThrownBy(() -> executor.execute(
                "SELECT name FROM customers WHERE id = :id AND region = :region",
                QueryParameters.named(Map.of("id", 1))))
                .isInstanceOf(QueryExecutionException.class)
                .hasMessageContaining(":region");
    }

    @Test
    void shouldPassPositionalValuesThrough() {
        // When
        JdbcQueryExecutor.BoundStatement bound = JdbcQueryExecutor.bind(
                "SELECT ? , ?", QueryParameters.positional(Arrays.asList(1, null)));

        // Then
        assertThat(bound.sql()).isEqualTo("SELECT ? , ?");
        assertThat(bound.values()).isEqualTo(Arrays.asList(1, null));
    }
}
