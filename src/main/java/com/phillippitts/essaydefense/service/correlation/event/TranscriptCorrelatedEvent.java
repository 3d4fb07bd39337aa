package com.phillippitts.essaydefense.service.correlation.event;

import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.service.correlation.MatchMethod;

import java.time.Instant;

/**
 * Published after a transcript has been attached to a submission.
 *
 * <p>PII note: carries no transcript text.
 */
public record TranscriptCorrelatedEvent(
        String sessionId,
        String conversationId,
        MatchMethod method,
        SubmissionStatus status,
        Instant at
) {
    public TranscriptCorrelatedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
