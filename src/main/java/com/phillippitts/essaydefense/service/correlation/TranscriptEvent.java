package com.phillippitts.essaydefense.service.correlation;

import com.phillippitts.essaydefense.domain.TranscriptTurn;

import java.util.List;

/**
 * A finished defense conversation as reported by the voice provider, either pushed by webhook or
 * pulled by the recovery sweep.
 *
 * @param turns               conversation turns in spoken order
 * @param conversationId      provider conversation id, may be null
 * @param claimedSessionId    correlation token echoed back by the provider, may be null
 * @param callDurationSeconds call length, null if the provider did not report it
 * @param rawPayload          original payload text, kept for manual reconciliation when nothing matches
 */
public record TranscriptEvent(
        List<TranscriptTurn> turns,
        String conversationId,
        String claimedSessionId,
        Integer callDurationSeconds,
        String rawPayload
) {

    public TranscriptEvent {
        turns = turns == null ? List.of() : List.copyOf(turns);
        conversationId = blankToNull(conversationId);
        claimedSessionId = blankToNull(claimedSessionId);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
