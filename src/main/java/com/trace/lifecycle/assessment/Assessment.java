package com.trace.lifecycle.assessment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Label attached to a finished trace after the fact. Exactly one of
 * {@code expectation} and {@code feedback} is set.
 *
 * @param assessmentId      identifier, assigned by the store
 * @param traceId           assessed trace
 * @param spanId            assessed span, or {@code null} for the whole trace
 * @param name              assessment name, e.g. {@code faithfulness}
 * @param source            producer of the assessment
 * @param createTimeMs      creation time in epoch milliseconds
 * @param lastUpdateTimeMs  last update time in epoch milliseconds
 * @param expectation       expectation payload, or {@code null}
 * @param feedback          feedback payload, or {@code null}
 * @param rationale         optional free-text justification
 * @param metadata          free-form string metadata
 */
public record Assessment(
        String assessmentId,
        String traceId,
        String spanId,
        String name,
        AssessmentSource source,
        long createTimeMs,
        long lastUpdateTimeMs,
        Expectation expectation,
        Feedback feedback,
        String rationale,
        Map<String, String> metadata
) {

    public Assessment {
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("traceId must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if ((expectation == null) == (feedback == null)) {
            throw new IllegalArgumentException("Exactly one of expectation or feedback must be set");
        }
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public boolean isExpectation() {
        return expectation != null;
    }

    public boolean isFeedback() {
        return feedback != null;
    }

    Assessment withId(String id) {
        return new Assessment(id, traceId, spanId, name, source, createTimeMs, lastUpdateTimeMs,
                expectation, feedback, rationale, metadata);
    }

    /**
     * Applies the non-null fields of {@code update}.
     */
    Assessment apply(AssessmentUpdate update, long updateTimeMs) {
        return new Assessment(
                assessmentId,
                traceId,
                spanId,
                update.name() != null ? update.name() : name,
                source,
                createTimeMs,
                updateTimeMs,
                update.expectation() != null ? update.expectation() : expectation,
                update.feedback() != null ? update.feedback() : feedback,
                update.rationale() != null ? update.rationale() : rationale,
                update.metadata() != null ? update.metadata() : metadata
        );
    }
}
