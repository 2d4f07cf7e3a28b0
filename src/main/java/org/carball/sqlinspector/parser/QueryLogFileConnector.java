package org.carball.sqlinspector.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.sqlinspector.model.query.QueryParameters;
import org.carball.sqlinspector.model.query.QueryRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the queries of one captured request from a JSON query log.
 *
 * <pre>
 * {
 *   "request_metadata": { "request_id": "...", "path": "/orders", "captured_at": "..." },
 *   "queries": [
 *     { "statement": "SELECT ...", "parameters": [1], "duration_ms": 1.5, "context": "...",
 *       "stacktrace": [ { "class": "...", "method": "...", "file": "...", "line": 12 } ] }
 *   ]
 * }
 * </pre>
 *
 * Per-query fields are not validated here; a query without a statement or
 * duration is passed on as-is and rejected by the aggregator.
 */
public class QueryLogFileConnector {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonNode logData;

    public QueryLogFileConnector(String filePath) throws IOException {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            throw new IOException("Query log file not found: " + filePath);
        }

        String content = Files.readString(path);
        logData = objectMapper.readTree(content);

        validateLogFormat();
    }

    /**
     * Extracts every query in the order it was executed.
     */
    public List<QueryRecord> getAllQueries() {
        List<QueryRecord> results = new ArrayList<>();
        for (JsonNode queryNode : logData.get("queries")) {
            results.add(parseQueryFromJson(queryNode));
        }
        return results;
    }

    public int getQueryCount() {
        return logData.get("queries").size();
    }

    /**
     * Describes the request the queries were captured from. Missing fields are {@code null}.
     */
    public RequestMetadata getRequestMetadata() {
        JsonNode metadata = logData.get("request_metadata");
        if (metadata == null || !metadata.isObject()) {
            return new RequestMetadata(null, null, null);
        }
        return new RequestMetadata(
                textOrNull(metadata, "request_id"),
                textOrNull(metadata, "path"),
                textOrNull(metadata, "captured_at"));
    }

    private void validateLogFormat() {
        if (logData == null || !logData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in query log file");
        }

        JsonNode queries = logData.get("queries");
        if (queries == null || !queries.isArray()) {
            throw new IllegalStateException("Missing or invalid queries section in query log file");
        }

        for (int i = 0; i < queries.size(); i++) {
            JsonNode query = queries.get(i);
            if (!query.isObject()) {
                throw new IllegalStateException("Query #" + (i + 1) + " is not an object");
            }
            JsonNode stacktrace = query.get("stacktrace");
            if (stacktrace != null && !stacktrace.isNull() && !stacktrace.isArray()) {
                throw new IllegalStateException("Query #" + (i + 1) + " has a stacktrace that is not an array");
            }
            JsonNode parameters = query.get("parameters");
            if (parameters != null && !parameters.isNull() && !parameters.isArray() && !parameters.isObject()) {
                throw new IllegalStateException("Query #" + (i + 1) + " has parameters that are neither an array nor an object");
            }
        }
    }

    private QueryRecord parseQueryFromJson(JsonNode queryNode) {
        String statement = textOrNull(queryNode, "statement");
        JsonNode durationNode = queryNode.get("duration_ms");
        Double durationMs = durationNode != null && durationNode.isNumber() ? durationNode.asDouble() : null;
        String context = textOrNull(queryNode, "context");

        JsonNode parametersNode = queryNode.get("parameters");
        QueryParameters parameters = parametersNode == null || parametersNode.isNull()
                ? QueryParameters.none()
                : QueryParameters.fromJson(objectMapper.convertValue(parametersNode, Object.class));

        List<StackTraceElement> stacktrace = new ArrayList<>();
        JsonNode framesNode = queryNode.get("stacktrace");
        if (framesNode != null && framesNode.isArray()) {
            for (JsonNode frame : framesNode) {
                stacktrace.add(new StackTraceElement(
                        frame.path("class").asText("unknown"),
                        frame.path("method").asText("unknown"),
                        textOrNull(frame, "file"),
                        frame.path("line").asInt(-1)));
            }
        }

        return new QueryRecord(statement, parameters, durationMs, stacktrace, context);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * The request a query log was captured from.
     */
    public record RequestMetadata(String requestId, String path, String capturedAt) {
    }
}
