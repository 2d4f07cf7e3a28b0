package org.carball.sqlinspector.model.query;

import java.util.List;

/**
 * All executions sharing a grouping key within one request.
 *
 * @param groupId         1-based id in first-seen order
 * @param key             grouping key the executions share
 * @param statement       original statement text
 * @param sql             display form with the first execution's parameters substituted
 * @param totalDurationMs sum of execution durations
 * @param executions      executions in request order
 */
public record QueryGroup(
        int groupId,
        String key,
        String statement,
        String sql,
        double totalDurationMs,
        List<QueryExecution> executions
) {
    public QueryGroup {
        executions = List.copyOf(executions);
    }

    public int executionCount() {
        return executions.size();
    }

    public double averageDurationMs() {
        return executions.isEmpty() ? 0.0 : totalDurationMs / executions.size();
    }

    public boolean isRepeated() {
        return executions.size() > 1;
    }
}
