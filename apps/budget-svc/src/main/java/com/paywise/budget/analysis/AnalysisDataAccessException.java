package com.paywise.budget.analysis;

public class AnalysisDataAccessException extends RuntimeException {

    private final String query;

    public AnalysisDataAccessException(String query, Throwable cause) {
        super("Failed to load analysis input (" + query + "): " + cause.getMessage(), cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
