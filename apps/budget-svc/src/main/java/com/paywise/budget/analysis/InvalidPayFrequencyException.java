package com.paywise.budget.analysis;

public class InvalidPayFrequencyException extends IllegalArgumentException {

    public InvalidPayFrequencyException(String message) {
        super(message);
    }
}
