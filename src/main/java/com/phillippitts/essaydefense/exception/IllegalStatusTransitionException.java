package com.phillippitts.essaydefense.exception;

import com.phillippitts.essaydefense.domain.SubmissionStatus;

/**
 * Thrown when a status change would move a submission backwards or sideways
 * outside the permitted manual toggle.
 */
public class IllegalStatusTransitionException extends EssayDefenseException {

    private final String sessionId;
    private final SubmissionStatus from;
    private final SubmissionStatus to;

    public IllegalStatusTransitionException(String sessionId, SubmissionStatus from, SubmissionStatus to) {
        super("Illegal status transition for session " + sessionId + ": " + from + " -> " + to);
        this.sessionId = sessionId;
        this.from = from;
        this.to = to;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SubmissionStatus getFrom() {
        return from;
    }

    public SubmissionStatus getTo() {
        return to;
    }
}
