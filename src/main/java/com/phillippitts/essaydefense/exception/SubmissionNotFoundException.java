package com.phillippitts.essaydefense.exception;

/**
 * Thrown when an operation addresses a session id that no submission owns.
 */
public class SubmissionNotFoundException extends EssayDefenseException {

    private final String sessionId;

    public SubmissionNotFoundException(String sessionId) {
        super("No submission found for session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
