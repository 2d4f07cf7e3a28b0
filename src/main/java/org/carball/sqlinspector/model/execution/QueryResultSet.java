package org.carball.sqlinspector.model.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Column headers and row values returned by re-running a verified statement.
 */
public record QueryResultSet(
        List<String> headers,
        List<List<Object>> rows,
        String sql,
        double durationMs
) {
    public QueryResultSet {
        headers = List.copyOf(headers);
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            // rows may hold SQL NULLs, so List.copyOf is not an option
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public int rowCount() {
        return rows.size();
    }
}
