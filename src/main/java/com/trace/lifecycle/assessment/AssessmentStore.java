package com.trace.lifecycle.assessment;

import java.util.List;
import java.util.Optional;

/**
 * Storage for trace assessments. Writes go directly to the store, outside the export pipeline.
 */
public interface AssessmentStore {

    /**
     * Stores a new assessment and returns it with its assigned identifier.
     */
    Assessment create(Assessment assessment);

    /**
     * @throws IllegalArgumentException if no assessment {@code assessmentId} exists on {@code traceId}
     */
    Assessment update(String traceId, String assessmentId, AssessmentUpdate update, long updateTimeMs);

    /**
     * @throws IllegalArgumentException if no assessment {@code assessmentId} exists on {@code traceId}
     */
    void delete(String traceId, String assessmentId);

    Optional<Assessment> get(String traceId, String assessmentId);

    List<Assessment> findByTrace(String traceId);
}
