package org.carball.sqlinspector.exception;

/**
 * Re-executing a verified statement failed inside the database driver.
 */
public class QueryExecutionException extends SqlInspectorException {

    public QueryExecutionException(String message) {
        super(message, 500);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, 500, cause);
    }
}
