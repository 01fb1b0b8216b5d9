package com.paywise.budget.analysis;

/**
 * Raised when a summary is requested over zero periods.
 */
public class EmptyAnalysisInputException extends IllegalStateException {

    public EmptyAnalysisInputException(String message) {
        super(message);
    }
}
