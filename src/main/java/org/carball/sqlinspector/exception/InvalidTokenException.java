package org.carball.sqlinspector.exception;

/**
 * A query token whose signature does not verify or whose encoding is malformed.
 */
public class InvalidTokenException extends SqlInspectorException {

    public static final int STATUS_NOT_ACCEPTABLE = 406;

    public InvalidTokenException(String message) {
        super(message, STATUS_NOT_ACCEPTABLE);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, STATUS_NOT_ACCEPTABLE, cause);
    }
}
