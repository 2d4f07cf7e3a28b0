package org.carball.sqlinspector.inspector;

import lombok.extern.slf4j.Slf4j;
import org.carball.sqlinspector.analyzer.QueryAggregator;
import org.carball.sqlinspector.cache.QueryResultCache;
import org.carball.sqlinspector.config.InspectorConfig;
import org.carball.sqlinspector.exception.ExecutionUnavailableException;
import org.carball.sqlinspector.exception.ResultNotFoundException;
import org.carball.sqlinspector.execution.ExplainStatements;
import org.carball.sqlinspector.execution.QueryExecutor;
import org.carball.sqlinspector.model.execution.QueryResultSet;
import org.carball.sqlinspector.model.query.AggregationResult;
import org.carball.sqlinspector.model.query.QueryGroup;
import org.carball.sqlinspector.model.query.QueryRecord;
import org.carball.sqlinspector.token.QueryTokenCodec;
import org.carball.sqlinspector.token.VerifiedQuery;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for a host application. Created once at startup with the
 * process-wide result cache and shared by every request handler.
 */
@Slf4j
public class SqlInspector {

    private final InspectorConfig config;
    private final QueryTokenCodec tokenCodec;
    private final QueryAggregator aggregator;
    private final QueryResultCache resultCache;
    private final QueryExecutor executor;

    public SqlInspector(InspectorConfig config, QueryResultCache resultCache) {
        this(config, resultCache, null);
    }

    public SqlInspector(InspectorConfig config, QueryResultCache resultCache, QueryExecutor executor) {
        this(config, new QueryTokenCodec(validated(config)), resultCache, executor);
    }

    private SqlInspector(InspectorConfig config, QueryTokenCodec tokenCodec,
                         QueryResultCache resultCache, QueryExecutor executor) {
        this(config, tokenCodec, new QueryAggregator(config, tokenCodec), resultCache, executor);
    }

    public SqlInspector(InspectorConfig config,
                        QueryTokenCodec tokenCodec,
                        QueryAggregator aggregator,
                        QueryResultCache resultCache,
                        QueryExecutor executor) {
        this.config = Objects.requireNonNull(config, "config");
        this.tokenCodec = Objects.requireNonNull(tokenCodec, "tokenCodec");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.resultCache = Objects.requireNonNull(resultCache, "resultCache");
        this.executor = executor;

        if (config.isExecutionAvailable() && executor == null) {
            log.warn("Execution is enabled in configuration but no query executor was supplied; select-again and explain are disabled");
        }
        log.info("Initialized SqlInspector: {}", config.getConfigurationSummary());
    }

    /**
     * Aggregates one request's queries and stores the result under a fresh key.
     */
    public InspectionSnapshot inspect(List<QueryRecord> records) {
        AggregationResult result = aggregator.aggregate(records);
        String key = QueryResultCache.newKey();
        resultCache.put(key, result);

        log.info("Inspected {} queries in {} groups: {} ms total, {} ms avoidable (key {}, {}/{} cached)",
                result.totalExecutionCount(), result.groups().size(),
                result.totalSqlTimeMs(), result.avoidableTimeMs(), key,
                resultCache.size(), resultCache.getCapacity());
        return new InspectionSnapshot(key, result);
    }

    /**
     * Returns a previously stored aggregation.
     *
     * @throws ResultNotFoundException if the key is unknown or has been evicted
     */
    public AggregationResult cachedResult(String key) {
        return resultCache.get(key);
    }

    /**
     * Returns one group of a previously stored aggregation, with all its executions.
     *
     * @throws ResultNotFoundException if the key has expired or the group does not exist
     */
    public QueryGroup executions(String key, int groupId) {
        return resultCache.get(key)
                .group(groupId)
                .orElseThrow(() -> new ResultNotFoundException("No query group " + groupId + " for key " + key));
    }

    /**
     * Runs the statement carried by a signed token again and returns its rows.
     */
    public QueryResultSet selectAgain(String token) {
        VerifiedQuery query = tokenCodec.verify(token);
        QueryExecutor available = requireExecutor();

        log.debug("Re-running verified statement");
        return available.execute(query.statement(), query.parameters());
    }

    /**
     * Asks the database for the plan of the statement carried by a signed token.
     */
    public QueryResultSet explain(String token) {
        VerifiedQuery query = tokenCodec.verify(token);
        QueryExecutor available = requireExecutor();

        String explainStatement = ExplainStatements.explain(query.statement(), available.databaseProduct());
        log.debug("Explaining verified statement with '{}'", ExplainStatements.prefixFor(available.databaseProduct()));
        return available.execute(explainStatement, query.parameters());
    }

    public boolean isExecutionAvailable() {
        return config.isExecutionAvailable() && executor != null;
    }

    public QueryTokenCodec getTokenCodec() {
        return tokenCodec;
    }

    public InspectorConfig getConfig() {
        return config;
    }

    private QueryExecutor requireExecutor() {
        if (!isExecutionAvailable()) {
            throw new ExecutionUnavailableException();
        }
        return executor;
    }

    private static InspectorConfig validated(InspectorConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return config;
    }
}
