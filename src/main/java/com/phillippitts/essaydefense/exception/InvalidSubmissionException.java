package com.phillippitts.essaydefense.exception;

/**
 * Thrown when a submission request is missing a required field or carries an unusable value.
 */
public class InvalidSubmissionException extends EssayDefenseException {

    private final String field;

    public InvalidSubmissionException(String field, String reason) {
        super("Invalid submission: " + field + " " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
