package org.carball.sqlinspector.exception;

public class ExecutionUnavailableException extends SqlInspectorException {

    public ExecutionUnavailableException() {
        super("Query execution is not available in this environment", 501);
    }
}
