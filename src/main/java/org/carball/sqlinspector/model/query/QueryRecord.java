package org.carball.sqlinspector.model.query;

import java.util.List;

/**
 * One statement executed while serving a request, as handed over by the
 * query-recording integration.
 *
 * @param statement  SQL text as sent to the driver
 * @param parameters bound values
 * @param durationMs wall-clock execution time; {@code null} means the recorder did not measure it
 * @param stacktrace caller frames, innermost first
 * @param context    free-form diagnostic text from the recorder
 */
public record QueryRecord(
        String statement,
        QueryParameters parameters,
        Double durationMs,
        List<StackTraceElement> stacktrace,
        String context
) {
    public QueryRecord {
        parameters = parameters == null ? QueryParameters.none() : parameters;
        stacktrace = stacktrace == null ? List.of() : List.copyOf(stacktrace);
    }

    public static QueryRecord of(String statement, QueryParameters parameters, double durationMs) {
        return new QueryRecord(statement, parameters, durationMs, List.of(), null);
    }
}
