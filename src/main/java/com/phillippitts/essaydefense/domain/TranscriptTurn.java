package com.phillippitts.essaydefense.domain;

import java.util.Objects;

/**
 * A single utterance in a defense conversation.
 *
 * @param speaker who spoke
 * @param message what was said (may be empty for silent turns)
 */
public record TranscriptTurn(Speaker speaker, String message) {

    public TranscriptTurn {
        Objects.requireNonNull(speaker, "Speaker must not be null");
        message = message == null ? "" : message;
    }

    public static TranscriptTurn of(String role, String message) {
        return new TranscriptTurn(Speaker.fromRole(role), message);
    }
}
