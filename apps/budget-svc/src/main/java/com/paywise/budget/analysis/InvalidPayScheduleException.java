package com.paywise.budget.analysis;

/**
 * The pay schedule anchor is too far from the requested date for periods to be derived.
 */
public class InvalidPayScheduleException extends IllegalArgumentException {

    public InvalidPayScheduleException(String message) {
        super(message);
    }
}
