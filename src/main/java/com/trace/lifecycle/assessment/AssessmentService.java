package com.trace.lifecycle.assessment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Logs, updates and deletes expectations and feedback on finished traces.
 */
public class AssessmentService {
    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    static final String INVALID_SOURCE = "`source` must be an instance of AssessmentSource";

    private final AssessmentStore store;
    private final Clock clock;

    public AssessmentService(AssessmentStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Records the expected result of a trace.
     *
     * @throws IllegalArgumentException if {@code value} or {@code source} is null
     */
    public Assessment logExpectation(String traceId, String name, Object value,
                                     AssessmentSource source, Map<String, String> metadata) {
        Expectation expectation = new Expectation(value);
        requireSource(source);
        long now = clock.millis();
        Assessment created = store.create(new Assessment(null, traceId, null, name, source, now, now,
                expectation, null, null, metadata));
        log.info("assessment.expectation.logged traceId={} assessmentId={} name={}",
                traceId, created.assessmentId(), name);
        return created;
    }

    /**
     * Records an evaluation of a trace. Either {@code value} or {@code error} is required; both are allowed.
     *
     * @throws IllegalArgumentException if both {@code value} and {@code error} are null, or {@code source} is null
     */
    public Assessment logFeedback(String traceId, String name, Object value, AssessmentSource source,
                                  AssessmentError error, String rationale, Map<String, String> metadata) {
        Feedback feedback = new Feedback(value, error);
        requireSource(source);
        long now = clock.millis();
        Assessment created = store.create(new Assessment(null, traceId, null, name, source, now, now,
                null, feedback, rationale, metadata));
        log.info("assessment.feedback.logged traceId={} assessmentId={} name={} error={}",
                traceId, created.assessmentId(), name, error != null ? error.errorCode() : null);
        return created;
    }

    public Assessment updateExpectation(String traceId, String assessmentId, Object value) {
        Assessment updated = store.update(traceId, assessmentId,
                AssessmentUpdate.ofExpectation(new Expectation(value)), clock.millis());
        log.debug("assessment.expectation.updated traceId={} assessmentId={}", traceId, assessmentId);
        return updated;
    }

    public Assessment updateFeedback(String traceId, String assessmentId, Object value,
                                     String rationale, Map<String, String> metadata) {
        Assessment updated = store.update(traceId, assessmentId,
                AssessmentUpdate.ofFeedback(new Feedback(value), rationale, metadata), clock.millis());
        log.debug("assessment.feedback.updated traceId={} assessmentId={}", traceId, assessmentId);
        return updated;
    }

    public void deleteExpectation(String traceId, String assessmentId) {
        store.delete(traceId, assessmentId);
        log.debug("assessment.expectation.deleted traceId={} assessmentId={}", traceId, assessmentId);
    }

    public void deleteFeedback(String traceId, String assessmentId) {
        store.delete(traceId, assessmentId);
        log.debug("assessment.feedback.deleted traceId={} assessmentId={}", traceId, assessmentId);
    }

    public List<Assessment> getAssessments(String traceId) {
        return store.findByTrace(traceId);
    }

    private static void requireSource(AssessmentSource source) {
        if (source == null) {
            throw new IllegalArgumentException(INVALID_SOURCE);
        }
    }
}
