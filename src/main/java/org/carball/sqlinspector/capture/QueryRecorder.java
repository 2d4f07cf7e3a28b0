package org.carball.sqlinspector.capture;

import org.carball.sqlinspector.model.query.QueryParameters;
import org.carball.sqlinspector.model.query.QueryRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the queries of one request as they run. The host creates one per
 * request and calls {@link #record} after each statement completes; the
 * caller's stack is captured at that point.
 */
public class QueryRecorder {

    private final List<QueryRecord> records = new ArrayList<>();

    public synchronized void record(String statement, QueryParameters parameters, double durationMs, String context) {
        records.add(new QueryRecord(statement, parameters, durationMs, callerFrames(), context));
    }

    public void record(String statement, QueryParameters parameters, double durationMs) {
        record(statement, parameters, durationMs, null);
    }

    /**
     * Snapshot of everything recorded so far, in execution order.
     */
    public synchronized List<QueryRecord> records() {
        return List.copyOf(records);
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized void clear() {
        records.clear();
    }

    private static List<StackTraceElement> callerFrames() {
        String self = QueryRecorder.class.getName();
        return Arrays.stream(new Throwable().getStackTrace())
                .dropWhile(frame -> frame.getClassName().equals(self))
                .collect(Collectors.toList());
    }
}
