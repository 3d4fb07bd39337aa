package com.phillippitts.essaydefense.service.recovery;

import com.phillippitts.essaydefense.service.correlation.TranscriptEvent;

import java.util.Objects;

/**
 * What the voice provider knows about one conversation.
 *
 * @param outcome classification
 * @param event   the conversation; always present for {@link Outcome#FOUND}, and for
 *                {@link Outcome#IN_PROGRESS} when the provider returned its detail
 * @param detail  short human-readable reason for anything but FOUND
 */
public record FetchResult(Outcome outcome, TranscriptEvent event, String detail) {

    public enum Outcome {
        /** Conversation finished and its transcript is available. */
        FOUND,
        /** The provider has no such conversation. */
        NOT_FOUND,
        /** The conversation exists but has not finished. */
        IN_PROGRESS,
        /** The lookup failed; try again on the next sweep. */
        ERROR
    }

    public FetchResult {
        Objects.requireNonNull(outcome, "outcome");
        if (outcome == Outcome.FOUND) {
            Objects.requireNonNull(event, "FOUND requires an event");
        }
    }

    public static FetchResult found(TranscriptEvent event) {
        return new FetchResult(Outcome.FOUND, event, null);
    }

    public static FetchResult notFound(String detail) {
        return new FetchResult(Outcome.NOT_FOUND, null, detail);
    }

    public static FetchResult inProgress(String detail) {
        return new FetchResult(Outcome.IN_PROGRESS, null, detail);
    }

    public static FetchResult inProgress(TranscriptEvent event, String detail) {
        return new FetchResult(Outcome.IN_PROGRESS, event, detail);
    }

    public static FetchResult error(String detail) {
        return new FetchResult(Outcome.ERROR, null, detail);
    }
}
