package com.trace.lifecycle.assessment;

/**
 * Evaluation of a trace. Carries a value, an error, or both.
 */
public record Feedback(Object value, AssessmentError error) {

    public Feedback {
        if (value == null && error == null) {
            throw new IllegalArgumentException("Either `value` or `error` must be provided.");
        }
    }

    public Feedback(Object value) {
        this(value, null);
    }
}
