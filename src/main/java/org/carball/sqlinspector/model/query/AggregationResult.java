package org.carball.sqlinspector.model.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything learned from one request's queries. Immutable, so it can be
 * cached and read by other requests without copying.
 *
 * @param groups                   groups by id, in first-seen order
 * @param totalSqlTimeMs           sum of every execution's duration
 * @param sqlTimeDuringRenderingMs part of the total spent while a template was rendering
 * @param totalExecutionCount      number of executions across all groups
 * @param repeatedGroupIds         ids of groups executed more than once
 * @param avoidableTimeMs          estimated time repeated executions added over a single execution
 * @param queriesByDuration        sequence numbers, slowest execution first
 * @param groupsByDuration         group ids, largest total duration first
 */
public record AggregationResult(
        Map<Integer, QueryGroup> groups,
        double totalSqlTimeMs,
        double sqlTimeDuringRenderingMs,
        int totalExecutionCount,
        List<Integer> repeatedGroupIds,
        double avoidableTimeMs,
        List<Integer> queriesByDuration,
        List<Integer> groupsByDuration
) {
    public AggregationResult {
        groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
        repeatedGroupIds = List.copyOf(repeatedGroupIds);
        queriesByDuration = List.copyOf(queriesByDuration);
        groupsByDuration = List.copyOf(groupsByDuration);
    }

    public Optional<QueryGroup> group(int groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    /**
     * Looks up an execution by its sequence number across all groups.
     */
    public Optional<QueryExecution> execution(int sequenceNumber) {
        return groups.values().stream()
                .flatMap(group -> group.executions().stream())
                .filter(execution -> execution.sequenceNumber() == sequenceNumber)
                .findFirst();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
