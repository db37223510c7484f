package com.trace.lifecycle.assessment;

import java.util.Map;

/**
 * Partial update of an assessment. {@code null} fields are left unchanged.
 */
public record AssessmentUpdate(
        String name,
        Expectation expectation,
        Feedback feedback,
        String rationale,
        Map<String, String> metadata
) {

    public static AssessmentUpdate ofExpectation(Expectation expectation) {
        return new AssessmentUpdate(null, expectation, null, null, null);
    }

    public static AssessmentUpdate ofFeedback(Feedback feedback, String rationale, Map<String, String> metadata) {
        return new AssessmentUpdate(null, null, feedback, rationale, metadata);
    }
}
