package org.carball.sqlinspector.token;

import org.carball.sqlinspector.model.query.QueryParameters;

/**
 * A statement and its parameters recovered from a token whose signature checked out.
 */
public record VerifiedQuery(String statement, QueryParameters parameters) {
}
