package com.trace.lifecycle.assessment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link AssessmentStore}. Suitable for tests and single-process use.
 */
public class InMemoryAssessmentStore implements AssessmentStore {

    private final ConcurrentMap<String, ConcurrentMap<String, Assessment>> byTrace = new ConcurrentHashMap<>();

    @Override
    public Assessment create(Assessment assessment) {
        Assessment stored = assessment.withId("a-" + UUID.randomUUID().toString().replace("-", ""));
        byTrace.computeIfAbsent(stored.traceId(), k -> new ConcurrentHashMap<>())
                .put(stored.assessmentId(), stored);
        return stored;
    }

    @Override
    public Assessment update(String traceId, String assessmentId, AssessmentUpdate update, long updateTimeMs) {
        Map<String, Assessment> assessments = byTrace.get(traceId);
        Assessment updated = assessments != null
                ? assessments.computeIfPresent(assessmentId, (id, current) -> current.apply(update, updateTimeMs))
                : null;
        if (updated == null) {
            throw new IllegalArgumentException(
                    "Assessment " + assessmentId + " not found on trace " + traceId);
        }
        return updated;
    }

    @Override
    public void delete(String traceId, String assessmentId) {
        Map<String, Assessment> assessments = byTrace.get(traceId);
        if (assessments == null || assessments.remove(assessmentId) == null) {
            throw new IllegalArgumentException(
                    "Assessment " + assessmentId + " not found on trace " + traceId);
        }
    }

    @Override
    public Optional<Assessment> get(String traceId, String assessmentId) {
        Map<String, Assessment> assessments = byTrace.get(traceId);
        return assessments != null ? Optional.ofNullable(assessments.get(assessmentId)) : Optional.empty();
    }

    @Override
    public List<Assessment> findByTrace(String traceId) {
        Map<String, Assessment> assessments = byTrace.get(traceId);
        if (assessments == null) {
            return List.of();
        }
        List<Assessment> result = new ArrayList<>(assessments.values());
        result.sort(Comparator.comparingLong(Assessment::createTimeMs));
        return result;
    }
}
