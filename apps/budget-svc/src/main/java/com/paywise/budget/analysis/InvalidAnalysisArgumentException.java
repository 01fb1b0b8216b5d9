package com.paywise.budget.analysis;

public class InvalidAnalysisArgumentException extends IllegalArgumentException {

    public InvalidAnalysisArgumentException(String message) {
        super(message);
    }
}
