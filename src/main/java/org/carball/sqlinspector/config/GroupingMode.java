package org.carball.sqlinspector.config;

/**
 * How executions are collapsed into groups.
 */
public enum GroupingMode {
    /**
     * Group by raw statement text; calls that differ only in bound values share a group.
     */
    STATEMENT,

    /**
     * Group by statement with parameters substituted; only identical calls share a group.
     */
    STATEMENT_WITH_PARAMETERS
}
