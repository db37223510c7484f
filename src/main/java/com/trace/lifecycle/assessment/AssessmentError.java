package com.trace.lifecycle.assessment;

/**
 * Error raised while producing a feedback, e.g. a judge that hit its rate limit.
 */
public record AssessmentError(String errorCode, String errorMessage) {

    public AssessmentError {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode must not be blank");
        }
    }
}
