package com.phillippitts.essaydefense.domain;

import java.util.Locale;

/**
 * Two parties of a defense conversation.
 */
public enum Speaker {
    EXAMINER,
    STUDENT;

    /**
     * Maps a provider role label to a speaker. The voice agent speaks as "agent"
     * (or "assistant"), everything else is the student.
     */
    public static Speaker fromRole(String role) {
        if (role == null) {
            return STUDENT;
        }
        String r = role.trim().toLowerCase(Locale.ROOT);
        return switch (r) {
            case "agent", "assistant", "examiner", "ai", "bot" -> EXAMINER;
            default -> STUDENT;
        };
    }
}
