package com.example.websearcher.client;

/**
 * The agent finished with status {@code error}.
 */
public class QueryFailedException extends RuntimeException {

    public QueryFailedException(String error) {
        super("Query failed: " + error);
    }
}
