package org.carball.sqlinspector.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sqlinspector.config.GroupingMode;
import org.carball.sqlinspector.config.InspectorConfig;
import org.carball.sqlinspector.exception.MalformedRecordException;
import org.carball.sqlinspector.model.query.AggregationResult;
import org.carball.sqlinspector.model.query.QueryExecution;
import org.carball.sqlinspector.model.query.QueryGroup;
import org.carball.sqlinspector.model.query.QueryRecord;
import org.carball.sqlinspector.token.QueryTokenCodec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Groups the queries of one request by statement and derives timing metrics.
 */
@Slf4j
public class QueryAggregator {

    private final QueryTokenCodec tokenCodec;
    private final StackFrameFormatter frameFormatter;
    private final RenderingFrameClassifier renderingClassifier;
    private final GroupingMode groupingMode;

    public QueryAggregator(QueryTokenCodec tokenCodec,
                           StackFrameFormatter frameFormatter,
                           RenderingFrameClassifier renderingClassifier,
                           GroupingMode groupingMode) {
        this.tokenCodec = Objects.requireNonNull(tokenCodec, "tokenCodec");
        this.frameFormatter = Objects.requireNonNull(frameFormatter, "frameFormatter");
        this.renderingClassifier = Objects.requireNonNull(renderingClassifier, "renderingClassifier");
        this.groupingMode = Objects.requireNonNull(groupingMode, "groupingMode");
    }

    public QueryAggregator(InspectorConfig config, QueryTokenCodec tokenCodec) {
        this(tokenCodec,
                new StackFrameFormatter(config.getInternalFramePrefixes()),
                new KeywordRenderingClassifier(config.getRenderingKeywords()),
                config.getGroupingMode());
    }

    /**
     * Aggregates the queries of one request, in the order they were executed.
     *
     * @throws MalformedRecordException if a record has no statement or no usable duration
     */
    public AggregationResult aggregate(List<QueryRecord> records) {
        Objects.requireNonNull(records, "records");

        Map<String, GroupAccumulator> groupsByKey = new LinkedHashMap<>();
        List<QueryExecution> allExecutions = new ArrayList<>(records.size());
        double totalSqlTime = 0.0;
        double renderingTime = 0.0;

        for (int i = 0; i < records.size(); i++) {
            int sequenceNumber = i + 1;
            QueryRecord record = records.get(i);
            validate(record, sequenceNumber);

            List<String> stack = frameFormatter.format(record.stacktrace());
            List<String> shortenedStack = StackFrameFormatter.shorten(stack);
            String token = tokenCodec.sign(record.statement(), record.parameters()).orElse(null);

            QueryExecution execution = new QueryExecution(
                    sequenceNumber,
                    record.durationMs(),
                    record.parameters(),
                    record.context(),
                    stack,
                    shortenedStack,
                    token);

            String key = groupKey(record);
            GroupAccumulator group = groupsByKey.get(key);
            if (group == null) {
                group = new GroupAccumulator(groupsByKey.size() + 1, key, record);
                groupsByKey.put(key, group);
            }
            group.add(execution);
            allExecutions.add(execution);

            totalSqlTime += execution.durationMs();
            if (renderingClassifier.isRendering(shortenedStack)) {
                renderingTime += execution.durationMs();
            }

            log.debug("Query #{} ({} ms) assigned to group {}", sequenceNumber, execution.durationMs(), group.groupId);
        }

        Map<Integer, QueryGroup> groups = new LinkedHashMap<>();
        for (GroupAccumulator accumulator : groupsByKey.values()) {
            QueryGroup group = accumulator.toGroup();
            groups.put(group.groupId(), group);
        }

        List<Integer> repeatedGroupIds = groups.values().stream()
                .filter(QueryGroup::isRepeated)
                .map(QueryGroup::groupId)
                .collect(Collectors.toList());

        double avoidableTime = groups.values().stream()
                .filter(QueryGroup::isRepeated)
                .mapToDouble(group -> group.averageDurationMs() * (group.executionCount() - 1))
                .sum();

        // sorted() is stable on ordered streams, so equal durations keep request order
        List<Integer> queriesByDuration = allExecutions.stream()
                .sorted(Comparator.comparingDouble(QueryExecution::durationMs).reversed())
                .map(QueryExecution::sequenceNumber)
                .collect(Collectors.toList());

        List<Integer> groupsByDuration = groups.values().stream()
                .sorted(Comparator.comparingDouble(QueryGroup::totalDurationMs).reversed())
                .map(QueryGroup::groupId)
                .collect(Collectors.toList());

        log.debug("Aggregated {} queries into {} groups ({} repeated, {} ms avoidable)",
                records.size(), groups.size(), repeatedGroupIds.size(), avoidableTime);

        return new AggregationResult(
                groups,
                totalSqlTime,
                renderingTime,
                allExecutions.size(),
                repeatedGroupIds,
                avoidableTime,
                queriesByDuration,
                groupsByDuration);
    }

    public GroupingMode getGroupingMode() {
        return groupingMode;
    }

    private String groupKey(QueryRecord record) {
        switch (groupingMode) {
            case STATEMENT_WITH_PARAMETERS:
                return SqlFormatter.format(record.statement(), record.parameters());
            case STATEMENT:
            default:
                // same normalization as STATEMENT_WITH_PARAMETERS keys
                return record.statement().strip();
        }
    }

    private static void validate(QueryRecord record, int position) {
        String problem = null;
        if (record == null) {
            problem = "record is null";
        } else if (record.statement() == null || record.statement().isBlank()) {
            problem = "statement is missing";
        } else if (record.durationMs() == null) {
            problem = "duration is missing";
        } else if (record.durationMs().isNaN() || record.durationMs().isInfinite() || record.durationMs() < 0) {
            problem = "duration must be a non-negative number, got " + record.durationMs();
        }

        if (problem != null) {
            log.error("Query recorder supplied a malformed record at position {}: {}", position, problem);
            throw new MalformedRecordException(position, problem);
        }
    }

    private static final class GroupAccumulator {
        private final int groupId;
        private final String key;
        private final String statement;
        private final String sql;
        private final List<QueryExecution> executions = new ArrayList<>();
        private double totalDuration;

        GroupAccumulator(int groupId, String key, QueryRecord first) {
            this.groupId = groupId;
            this.key = key;
            this.statement = first.statement();
            this.sql = SqlFormatter.format(first.statement(), first.parameters());
        }

        void add(QueryExecution execution) {
            executions.add(execution);
            totalDuration += execution.durationMs();
        }

        QueryGroup toGroup() {
            return new QueryGroup(groupId, key, statement, sql, totalDuration, executions);
        }
    }
}
