package org.carball.sqlinspector.parser;

import org.carball.sqlinspector.model.query.QueryRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class QueryLogFileConnectorTest {

    @TempDir
    Path tempDir;

    private Path validLogFile;

    @BeforeEach
    void setUp() throws IOException {
        validLogFile = tempDir.resolve("request.json");
        Files.writeString(validLogFile, """
            {
              "request_metadata": {
                "request_id": "req-42",
                "path": "/orders",
                "captured_at": "2026-03-01T10:15:00Z"
              },
              "queries": [
                {
                  "statement": "SELECT * FROM orders WHERE customer_id = ?",
                  "parameters": [7],
                  "duration_ms": 12.5,
                  "context": "connection #3",
                  "stacktrace": [
                    { "class": "com.shop.web.OrderView", "method": "render", "file": "OrderView.java", "line": 51 },
                    { "class": "java.lang.Thread", "method": "run" }
                  ]
                },
                {
                  "statement": "SELECT name FROM customers WHERE id = :id",
                  "parameters": { "id": 7 },
                  "duration_ms": 3
                },
                {
                  "statement": "SELECT 1"
                }
              ]
            }
            """);
    }

    @Test
    void shouldReadAllQueriesInOrder() throws IOException {
        // Given
        QueryLogFileConnector connector = new QueryLogFileConnector(validLogFile.toString());

        // When
        List<QueryRecord> queries = connector.getAllQueries();

        // Then
        assertThat(connector.getQueryCount()).isEqualTo(3);
        assertThat(queries).extracting(QueryRecord::statement).containsExactly(
                "SELECT * FROM orders WHERE customer_id = ?",
                "SELECT name FROM customers WHERE id = :id",
                "SELECT 1");

        QueryRecord first = queries.get(0);
        assertThat(first.durationMs()).isEqualTo(12.5);
        assertThat(first.parameters().getPositional()).containsExactly(7);
        assertThat(first.context()).isEqualTo("connection #3");
        assertThat(first.stacktrace()).hasSize(2);
        assertThat(first.stacktrace().get(0).getClassName()).isEqualTo("com.shop.web.OrderView");
        assertThat(first.stacktrace().get(0).getLineNumber()).isEqualTo(51);
        assertThat(first.stacktrace().get(1).getFileName()).isNull();

        assertThat(queries.get(1).parameters().isNamed()).isTrue();
        assertThat(queries.get(1).parameters().getNamed()).containsEntry("id", 7);
        assertThat(queries.get(1).durationMs()).isEqualTo(3.0);
    }

    @Test
    void shouldLeaveMissingDurationForAggregatorToReject() throws IOException {
        // When
        QueryRecord last = new QueryLogFileConnector(validLogFile.toString()).getAllQueries().get(2);

        // Then
        assertThat(last.durationMs()).isNull();
        assertThat(last.parameters().isEmpty()).isTrue();
    }

    @Test
    void shouldReadRequestMetadata() throws IOException {
        // When
        QueryLogFileConnector.RequestMetadata metadata =
                new QueryLogFileConnector(validLogFile.toString()).getRequestMetadata();

        // Then
        assertThat(metadata.requestId()).isEqualTo("req-42");
        assertThat(metadata.path()).isEqualTo("/orders");
        assertThat(metadata.capturedAt()).isEqualTo("2026-03-01T10:15:00Z");
    }

    @Test
    void shouldTolerateMissingMetadata() throws IOException {
        // Given
        Path file = tempDir.resolve("bare.json");
        Files.writeString(file, "{\"queries\": []}");

        // When
        QueryLogFileConnector connector = new QueryLogFileConnector(file.toString());

        // Then
        assertThat(connector.getAllQueries()).isEmpty();
        assertThat(connector.getRequestMetadata().path()).isNull();
    }

    @Test
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> new QueryLogFileConnector(tempDir.resolve("nope.json").toString()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Query log file not found");
    }

    @Test
    void shouldRejectLogWithoutQueries() throws IOException {
        // Given
        Path file = tempDir.resolve("no-queries.json");
        Files.writeString(file, "{\"request_metadata\": {}}");

        // When/Then
        assertThatThrownBy(() -> new QueryLogFileConnector(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Missing or invalid queries section");
    }

    @Test
    void shouldRejectScalarParameters() throws IOException {
        // Given
        Path file = tempDir.resolve("scalar-params.json");
        Files.writeString(file, "{\"queries\": [{\"statement\": \"SELECT ?\", \"parameters\": 5, \"duration_ms\": 1}]}");

        // When/Then
        assertThatThrownBy(() -> new QueryLogFileConnector(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Query #1");
    }

    @Test
    void shouldRejectNonObjectDocument() throws IOException {
        // Given
        Path file = tempDir.resolve("array.json");
        Files.writeString(file, "[1, 2, 3]");

        // When/Then
        assertThatThrownBy(() -> new QueryLogFileConnector(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid JSON format");
    }
}
