package org.carball.sqlinspector.exception;

/**
 * The query-recording integration handed over a record without a statement or
 * with an unusable duration. Signals an integration bug, not bad user input.
 */
public class MalformedRecordException extends SqlInspectorException {

    public MalformedRecordException(int position, String problem) {
        super("Malformed query record #" + position + ": " + problem, 500);
    }
}
