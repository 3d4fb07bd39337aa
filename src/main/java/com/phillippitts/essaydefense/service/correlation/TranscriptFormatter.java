package com.phillippitts.essaydefense.service.correlation;

import com.phillippitts.essaydefense.domain.TranscriptTurn;

import java.util.List;

/**
 * Renders conversation turns as the readable log stored on a submission:
 *
 * <pre>
 * EXAMINER: Hello Jane, ...
 *
 * STUDENT: Hi, my name is Jane Doe.
 * </pre>
 *
 * Turns without text are skipped.
 */
public final class TranscriptFormatter {

    private TranscriptFormatter() {}

    public static String format(List<TranscriptTurn> turns) {
        if (turns == null || turns.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (TranscriptTurn turn : turns) {
            String message = turn.message().strip();
            if (message.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(turn.speaker().name()).append(": ").append(message);
        }
        return sb.toString();
    }
}
