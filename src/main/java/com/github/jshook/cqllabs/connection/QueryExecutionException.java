package com.github.jshook.cqllabs.connection;

/**
 * Exception thrown when a query cannot be prepared or executed.
 */
public class QueryExecutionException extends Exception {
    private final String query;

    /**
     * Creates a new QueryExecutionException with the given message.
     * @param message the error message
     * @param query the failing CQL text
     */
    public QueryExecutionException(String message, String query) {
        super(message);
        this.query = query;
    }

    /**
     * Creates a new QueryExecutionException with the given message and cause.
     * @param message the error message
     * @param query the failing CQL text
     * @param cause the cause of the exception
     */
    public QueryExecutionException(String message, String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    /**
     * Gets the CQL text of the failing statement.
     * @return the query
     */
    public String getQuery() {
        return query;
    }
}
