package org.carball.sqlinspector.execution;

import org.carball.sqlinspector.model.execution.QueryResultSet;
import org.carball.sqlinspector.model.query.QueryParameters;

/**
 * Runs a statement that has already been verified. Implementations must bind
 * the parameters through the driver and never splice them into the SQL text.
 */
public interface QueryExecutor {

    QueryResultSet execute(String statement, QueryParameters parameters);

    /**
     * Name of the database product behind this executor, e.g. {@code SQLite} or {@code H2}.
     */
    String databaseProduct();
}
