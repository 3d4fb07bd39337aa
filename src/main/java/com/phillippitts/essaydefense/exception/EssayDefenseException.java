package com.phillippitts.essaydefense.exception;

/**
 * Base exception for all essay-defense application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class EssayDefenseException extends RuntimeException {

    public EssayDefenseException(String message) {
        super(message);
    }

    public EssayDefenseException(String message, Throwable cause) {
        super(message, cause);
    }

    public EssayDefenseException(Throwable cause) {
        super(cause);
    }
}
