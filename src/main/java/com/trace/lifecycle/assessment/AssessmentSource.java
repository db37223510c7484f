package com.trace.lifecycle.assessment;

/**
 * Who produced an assessment.
 *
 * @param type     kind of source
 * @param sourceId identifier of the person, judge model or code that produced it
 */
public record AssessmentSource(SourceType type, String sourceId) {

    public enum SourceType { HUMAN, LLM_JUDGE, CODE }

    public AssessmentSource {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
    }

    public static AssessmentSource human(String sourceId) {
        return new AssessmentSource(SourceType.HUMAN, sourceId);
    }

    public static AssessmentSource llmJudge(String sourceId) {
        return new AssessmentSource(SourceType.LLM_JUDGE, sourceId);
    }

    public static AssessmentSource code(String sourceId) {
        return new AssessmentSource(SourceType.CODE, sourceId);
    }
}
