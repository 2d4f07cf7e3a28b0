package org.carball.sqlinspector.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.sqlinspector.model.query.AggregationResult;
import org.carball.sqlinspector.model.query.QueryExecution;
import org.carball.sqlinspector.model.query.QueryGroup;
import org.carball.sqlinspector.parser.QueryLogFileConnector.RequestMetadata;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Slf4j
public class InspectionReport {

    static final int SLOWEST_GROUPS_SHOWN = 5;

    private final String key;
    private final AggregationResult result;
    private final RequestMetadata requestMetadata;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public InspectionReport(String key, AggregationResult result, RequestMetadata requestMetadata) {
        this.key = key;
        this.result = result;
        this.requestMetadata = requestMetadata;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# SQL Query Inspection Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        if (key != null) {
            md.append("**Inspection key:** `").append(key).append("`  \n");
        }
        if (requestMetadata != null && requestMetadata.path() != null) {
            md.append("**Request:** `").append(requestMetadata.path()).append("`  \n");
        }
        md.append("\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Queries executed | ").append(result.totalExecutionCount()).append(" |\n");
        md.append("| Distinct statements | ").append(result.groups().size()).append(" |\n");
        md.append("| Total SQL time | ").append(millis(result.totalSqlTimeMs())).append(" |\n");
        md.append("| SQL time while rendering | ").append(millis(result.sqlTimeDuringRenderingMs())).append(" |\n");
        md.append("| Repeated statements | ").append(result.repeatedGroupIds().size()).append(" |\n");
        md.append("| Avoidable time | ").append(millis(result.avoidableTimeMs())).append(" |\n\n");

        if (result.isEmpty()) {
            md.append("**No queries were executed.**\n");
            return md.toString();
        }

        // Slowest statements
        md.append("## Slowest Statements\n\n");
        md.append("| # | Executions | Total | Average | SQL |\n");
        md.append("|---|------------|-------|---------|-----|\n");
        result.groupsByDuration().stream()
                .limit(SLOWEST_GROUPS_SHOWN)
                .map(id -> result.groups().get(id))
                .forEach(group -> md.append("| ").append(group.groupId())
                        .append(" | ").append(group.executionCount())
                        .append(" | ").append(millis(group.totalDurationMs()))
                        .append(" | ").append(millis(group.averageDurationMs()))
                        .append(" | `").append(preview(group.sql())).append("` |\n"));
        md.append("\n");

        // Repeated statements
        if (!result.repeatedGroupIds().isEmpty()) {
            md.append("## Repeated Statements\n\n");
            for (Integer id : result.repeatedGroupIds()) {
                QueryGroup group = result.groups().get(id);
                double avoidable = group.averageDurationMs() * (group.executionCount() - 1);
                md.append("- **#").append(id).append("** ran ").append(group.executionCount())
                        .append(" times, ").append(millis(avoidable)).append(" avoidable: `")
                        .append(preview(group.statement())).append("`\n");
            }
            md.append("\n");
        }

        // Per-group detail
        md.append("## Statements\n\n");
        for (QueryGroup group : result.groups().values()) {
            md.append("### ").append(group.groupId()).append(". ")
                    .append(group.executionCount()).append(group.executionCount() == 1 ? " execution" : " executions")
                    .append(", ").append(millis(group.totalDurationMs())).append("\n\n");
            md.append("```sql\n").append(group.sql()).append("\n```\n\n");

            for (QueryExecution execution : group.executions()) {
                md.append("- Query #").append(execution.sequenceNumber())
                        .append(": ").append(millis(execution.durationMs()));
                if (!execution.shortenedStack().isEmpty()) {
                    md.append(" from `").append(execution.shortenedStack().get(0)).append("`");
                }
                if (execution.hasToken()) {
                    md.append("  \n  token: `").append(execution.token()).append("`");
                }
                md.append("\n");
            }
            md.append("\n");
        }

        return md.toString();
    }

    private ReportData buildReportData() {
        ReportData data = new ReportData();
        data.setGeneratedAt(timestamp);
        data.setKey(key);
        data.setRequest(requestMetadata);
        data.setTotalExecutionCount(result.totalExecutionCount());
        data.setTotalSqlTimeMs(result.totalSqlTimeMs());
        data.setSqlTimeDuringRenderingMs(result.sqlTimeDuringRenderingMs());
        data.setAvoidableTimeMs(result.avoidableTimeMs());
        data.setRepeatedGroupIds(result.repeatedGroupIds());
        data.setQueriesByDuration(result.queriesByDuration());
        data.setGroupsByDuration(result.groupsByDuration());
        data.setGroups(new ArrayList<>(result.groups().values()));
        return data;
    }

    private static String millis(double value) {
        return String.format(Locale.ROOT, "%.2f ms", value);
    }

    private static String preview(String sql) {
        String flattened = sql.replaceAll("\\s+", " ").replace("`", "'");
        return flattened.length() > 100 ? flattened.substring(0, 100) + "..." : flattened;
    }

    @Data
    private static class ReportData {
        private LocalDateTime generatedAt;
        private String key;
        private RequestMetadata request;
        private int totalExecutionCount;
        private double totalSqlTimeMs;
        private double sqlTimeDuringRenderingMs;
        private double avoidableTimeMs;
        private List<Integer> repeatedGroupIds;
        private List<Integer> queriesByDuration;
        private List<Integer> groupsByDuration;
        private List<QueryGroup> groups;
    }
}
