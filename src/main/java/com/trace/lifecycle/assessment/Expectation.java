package com.trace.lifecycle.assessment;

/**
 * Ground-truth label for a trace, e.g. the expected answer.
 */
public record Expectation(Object value) {

    public Expectation {
        if (value == null) {
            throw new IllegalArgumentException("Expectation value cannot be null.");
        }
    }
}
