package com.phillippitts.essaydefense.exception;

/**
 * Thrown when a call to the voice provider or the grading AI fails after its retry budget.
 * The record the call was made for keeps its prior state.
 */
public class ExternalServiceException extends EssayDefenseException {

    private final String serviceName;
    private final int attempts;

    public ExternalServiceException(String message) {
        super(message);
        this.serviceName = "unknown";
        this.attempts = 0;
    }

    public ExternalServiceException(String message, String serviceName, int attempts) {
        super(message + " (service: " + serviceName + ")");
        this.serviceName = serviceName;
        this.attempts = attempts;
    }

    public ExternalServiceException(String message, String serviceName, int attempts, Throwable cause) {
        super(message + " (service: " + serviceName + ")", cause);
        this.serviceName = serviceName;
        this.attempts = attempts;
    }

    public String getServiceName() {
        return serviceName;
    }

    public int getAttempts() {
        return attempts;
    }
}
