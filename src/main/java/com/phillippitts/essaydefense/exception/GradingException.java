package com.phillippitts.essaydefense.exception;

/**
 * Thrown when a submission cannot be graded in its current shape, for example
 * because no transcript has been attached yet. The submission is left untouched.
 */
public class GradingException extends EssayDefenseException {

    private final String sessionId;

    public GradingException(String sessionId, String message) {
        super(message + " (session: " + sessionId + ")");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
