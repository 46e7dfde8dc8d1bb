package com.eainde.graphagent.error;

/**
 * The graph backend failed to execute a query.
 */
public class QueryException extends GraphAgentException {

    public QueryException(String message) {
        super(ErrorKind.QUERY, message);
    }

    public QueryException(String message, Throwable cause) {
        super(ErrorKind.QUERY, message, cause);
    }
}
