package com.phillippitts.essaydefense.service.correlation.event;

import java.time.Instant;

/**
 * Published when no submission could be found for a transcript. The raw payload travels with the
 * event so a listener can write it somewhere an operator will find it.
 */
public record UnmatchedTranscriptEvent(
        String conversationId,
        String claimedSessionId,
        String rawPayload,
        Instant at
) {
    public UnmatchedTranscriptEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
