package org.carball.sqlinspector.model.query;

import java.util.List;

/**
 * A single execution of a grouped statement.
 *
 * @param sequenceNumber 1-based position in the request's query list
 * @param stack          every caller frame, formatted
 * @param shortenedStack caller frames without library and JDK frames
 * @param token          signed re-execution token, {@code null} when the statement is not signable
 */
public record QueryExecution(
        int sequenceNumber,
        double durationMs,
        QueryParameters parameters,
        String context,
        List<String> stack,
        List<String> shortenedStack,
        String token
) {
    public QueryExecution {
        stack = List.copyOf(stack);
        shortenedStack = List.copyOf(shortenedStack);
    }

    public boolean hasToken() {
        return token != null;
    }
}
