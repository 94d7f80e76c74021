package com.example.cloudinvestigator.query;

/**
 * Raised by a {@link QueryExecutor} when a query could not produce results.
 * The message carries the executor's raw error text for classification.
 */
public class QueryExecutionException extends Exception {

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
