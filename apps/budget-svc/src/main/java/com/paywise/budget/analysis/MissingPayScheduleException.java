package com.paywise.budget.analysis;

/**
 * No pay schedule has been configured, so pay periods cannot be derived.
 */
public class MissingPayScheduleException extends RuntimeException {

    public MissingPayScheduleException() {
        super("Pay settings not configured. Please set up your pay schedule first.");
    }
}
