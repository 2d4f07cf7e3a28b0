package org.carball.sqlinspector.exception;

/**
 * Cached inspection data is absent, either never stored or already evicted.
 */
public class ResultNotFoundException extends SqlInspectorException {

    public static final int STATUS_NOT_FOUND = 404;

    public ResultNotFoundException(String message) {
        super(message, STATUS_NOT_FOUND);
    }
}
