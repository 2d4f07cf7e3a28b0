package org.carball.sqlinspector.analyzer;

import org.carball.sqlinspector.model.query.QueryParameters;
import org.carball.sqlinspector.parser.SqlPlaceholders;

import java.util.List;
import java.util.Map;

/**
 * Builds a human-readable SQL string with bound values written in place of
 * their placeholders. The result is for display only and is never executed.
 */
public final class SqlFormatter {

    private SqlFormatter() {
        // Utility class - prevent instantiation
    }

    public static String format(String statement, QueryParameters parameters) {
        if (statement == null) {
            return "";
        }
        if (parameters == null || parameters.isEmpty()) {
            return statement.strip();
        }

        List<Object> positional = parameters.getPositional();
        Map<String, Object> named = parameters.getNamed();

        String substituted = SqlPlaceholders.replace(statement,
                index -> index < positional.size() ? literal(positional.get(index)) : null,
                name -> named.containsKey(name) ? literal(named.get(name)) : null);
        return substituted.strip();
    }

    static String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }
}
