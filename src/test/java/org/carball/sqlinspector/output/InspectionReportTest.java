package org.carball.sqlinspector.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.sqlinspector.analyzer.QueryAggregator;
import org.carball.sqlinspector.config.InspectorConfig;
import org.carball.sqlinspector.model.query.AggregationResult;
import org.carball.sqlinspector.model.query.QueryParameters;
import org.carball.sqlinspector.model.query.QueryRecord;
import org.carball.sqlinspector.parser.QueryLogFileConnector.RequestMetadata;
import org.carball.sqlinspector.token.QueryTokenCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InspectionReportTest {

    private QueryAggregator aggregator;

    @BeforeEach
    void setUp() {
        InspectorConfig config = InspectorConfig.defaults("report-test-secret-key");
        aggregator = new QueryAggregator(config, new QueryTokenCodec(config));
    }

    @Test
    void shouldWriteJsonWithGroupsAndTokens() throws Exception {
        // Given
        AggregationResult result = aggregator.aggregate(List.of(
                QueryRecord.of("SELECT * FROM orders WHERE id = ?", QueryParameters.positional(1), 2),
                QueryRecord.of("SELECT * FROM orders WHERE id = ?", QueryParameters.positional(2), 4),
                QueryRecord.of("SELECT now()", QueryParameters.none(), 1)));
        InspectionReport report = new InspectionReport("key-1", result, new RequestMetadata("r1", "/orders", null));

        // When
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Then
        assertThat(json.get("key").asText()).isEqualTo("key-1");
        assertThat(json.get("request").get("path").asText()).isEqualTo("/orders");
        assertThat(json.get("totalExecutionCount").asInt()).isEqualTo(3);
        assertThat(json.get("avoidableTimeMs").asDouble()).isEqualTo(3.0);
        assertThat(json.get("generatedAt").isTextual()).isTrue();

        JsonNode firstGroup = json.get("groups").get(0);
        assertThat(firstGroup.get("statement").asText()).isEqualTo("SELECT * FROM orders WHERE id = ?");
        assertThat(firstGroup.get("sql").asText()).isEqualTo("SELECT * FROM orders WHERE id = 1");
        assertThat(firstGroup.get("executions")).hasSize(2);
        assertThat(firstGroup.get("executions").get(1).get("parameters").get(0).asInt()).isEqualTo(2);
        assertThat(firstGroup.get("executions").get(0).get("token").asText()).contains(".");

        JsonNode unsigned = json.get("groups").get(1).get("executions").get(0);
        assertThat(unsigned.has("token")).isFalse();
    }

    @Test
    void shouldWriteMarkdownSections() {
        // Given
        AggregationResult result = aggregator.aggregate(List.of(
                QueryRecord.of("SELECT * FROM orders WHERE id = ?", QueryParameters.positional(1), 2),
                QueryRecord.of("SELECT * FROM orders WHERE id = ?", QueryParameters.positional(2), 4)));
        InspectionReport report = new InspectionReport("key-2", result, null);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown).contains("# SQL Query Inspection Report");
        assertThat(markdown).contains("**Inspection key:** `key-2`");
        assertThat(markdown).contains("| Queries executed | 2 |");
        assertThat(markdown).contains("| Avoidable time | 3.00 ms |");
        assertThat(markdown).contains("## Slowest Statements");
        assertThat(markdown).contains("## Repeated Statements");
        assertThat(markdown).contains("- **#1** ran 2 times");
        assertThat(markdown).contains("token: `");
    }

    @Test
    void shouldDescribeRequestWithoutQueries() {
        // Given
        InspectionReport report = new InspectionReport("key-3", aggregator.aggregate(List.of()), null);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown).contains("**No queries were executed.**");
        assertThat(markdown).doesNotContain("## Slowest Statements");
    }
}
