package org.carball.sqlinspector.exception;

/**
 * Base type for every failure the inspector reports to its callers.
 * Carries the status code a web boundary should answer with.
 */
public class SqlInspectorException extends RuntimeException {

    private final int statusCode;

    public SqlInspectorException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SqlInspectorException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
