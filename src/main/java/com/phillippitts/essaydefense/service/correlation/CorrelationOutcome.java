package com.phillippitts.essaydefense.service.correlation;

import com.phillippitts.essaydefense.domain.SubmissionStatus;

/**
 * Result of applying a transcript event.
 *
 * @param status          what happened
 * @param sessionId       resolved submission, null for {@link Status#NO_MATCH}
 * @param method          how the submission was resolved
 * @param submissionStatus submission status after the attempt, null for {@link Status#NO_MATCH}
 */
public record CorrelationOutcome(Status status, String sessionId, MatchMethod method,
                                 SubmissionStatus submissionStatus) {

    public enum Status {
        /** Transcript attached and status advanced. */
        MATCHED,
        /** Submission already had its transcript; nothing changed. */
        DUPLICATE_IGNORED,
        /** Conversation id belongs to a different submission; nothing changed. */
        CONFLICT,
        /** No submission found by any method; nothing changed. */
        NO_MATCH
    }

    public static CorrelationOutcome noMatch() {
        return new CorrelationOutcome(Status.NO_MATCH, null, MatchMethod.NONE, null);
    }

    public boolean isApplied() {
        return status == Status.MATCHED;
    }
}
