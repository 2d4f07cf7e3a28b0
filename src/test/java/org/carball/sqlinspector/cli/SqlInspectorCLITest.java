package org.carball.sqlinspector.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SqlInspectorCLITest {

    private static final String SECRET = "cli-test-secret-value";

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private SqlInspectorCLI cli;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new SqlInspectorCLI(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void shouldAnalyzeQueryLogAndWriteBothReports() throws IOException {
        // Given
        Path log = tempDir.resolve("request.json");
        Files.writeString(log, """
            {
              "queries": [
                { "statement": "SELECT * FROM orders WHERE id = ?", "parameters": [1], "duration_ms": 10 },
                { "statement": "SELECT * FROM orders WHERE id = ?", "parameters": [2], "duration_ms": 20 },
                { "statement": "SELECT 2", "duration_ms": 5 }
              ]
            }
            """);
        Path output = tempDir.resolve("report.json");

        // When
        int exitCode = cli.run(new String[]{
                "analyze", log.toString(),
                "--output", output.toString(),
                "--format", "both",
                "--inspector.secret-key", SECRET
        });

        // Then
        assertThat(exitCode).isEqualTo(SqlInspectorCLI.EXIT_OK);
        assertThat(tempDir.resolve("report.json")).exists();
        assertThat(Files.readString(tempDir.resolve("report.md"))).contains("# SQL Query Inspection Report");
        assertThat(stdout()).contains("SQL INSPECTION SUMMARY");
        assertThat(stdout()).contains("Avoidable time:          15.00 ms");
    }

    @Test
    void shouldRejectForgedTokenBeforeConnecting() {
        // When
        int exitCode = cli.run(new String[]{
                "select", "forged.token",
                "--jdbc-url", "jdbc:h2:mem:cli_forged",
                "--inspector.secret-key", SECRET
        });

        // Then
        assertThat(exitCode).isEqualTo(SqlInspectorCLI.EXIT_REJECTED);
        assertThat(stderr()).contains("Rejected (406)");
    }

    @Test
    void shouldRequireJdbcUrlForSelect() {
        // When
        int exitCode = cli.run(new String[]{"select", "a.b", "--inspector.secret-key", SECRET});

        // Then
        assertThat(exitCode).isEqualTo(SqlInspectorCLI.EXIT_USAGE);
        assertThat(stderr()).contains("A JDBC URL is required");
    }

    @Test
    void shouldReportMissingLogFile() {
        // When
        int exitCode = cli.run(new String[]{
                "analyze", tempDir.resolve("missing.json").toString(),
                "--inspector.secret-key", SECRET
        });

        // Then
        assertThat(exitCode).isEqualTo(SqlInspectorCLI.EXIT_USAGE);
        assertThat(stderr()).contains("Query log file not found");
    }

    @Test
    void shouldPrintUsageForHelp() {
        // When
        int exitCode = cli.run(new String[]{"--help"});

        // Then
        assertThat(exitCode).isEqualTo(SqlInspectorCLI.EXIT_OK);
        assertThat(stdout()).contains("Usage:").contains("Inspector Configuration Options:");
    }

    @Test
    void shouldStripFileExtension() {
        assertThat(SqlInspectorCLI.removeFileExtension("out/report.json")).isEqualTo("out/report");
        assertThat(SqlInspectorCLI.removeFileExtension("out.d/report")).isEqualTo("out.d/report");
        assertThat(SqlInspectorCLI.removeFileExtension(".hidden")).isEqualTo(".hidden");
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
