package org.carball.sqlinspector.execution;

import java.util.Locale;

/**
 * Picks the verb that asks a database for its query plan.
 */
public final class ExplainStatements {

    public static final String SQLITE_EXPLAIN = "EXPLAIN QUERY PLAN";
    public static final String DEFAULT_EXPLAIN = "EXPLAIN";

    private ExplainStatements() {
        // Utility class - prevent instantiation
    }

    public static String prefixFor(String databaseProduct) {
        if (databaseProduct != null && databaseProduct.toLowerCase(Locale.ROOT).contains("sqlite")) {
            return SQLITE_EXPLAIN;
        }
        return DEFAULT_EXPLAIN;
    }

    public static String explain(String statement, String databaseProduct) {
        return prefixFor(databaseProduct) + " " + statement.strip();
    }
}
