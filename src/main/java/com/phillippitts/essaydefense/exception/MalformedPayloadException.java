package com.phillippitts.essaydefense.exception;

/**
 * Thrown when an inbound webhook body is not valid JSON or not an object.
 */
public class MalformedPayloadException extends EssayDefenseException {

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
