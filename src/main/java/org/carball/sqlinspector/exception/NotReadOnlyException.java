package org.carball.sqlinspector.exception;

/**
 * A correctly signed token whose statement no longer passes the read-only check.
 */
public class NotReadOnlyException extends SqlInspectorException {

    public NotReadOnlyException(String keyword) {
        super("Statement is not a read-only '" + keyword + "' statement", InvalidTokenException.STATUS_NOT_ACCEPTABLE);
    }
}
