package com.phillippitts.essaydefense.exception;

/**
 * Thrown when a transcript webhook call presents a missing or wrong shared secret.
 * The request is rejected before any record is read or written.
 */
public class WebhookAuthenticationException extends EssayDefenseException {

    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
