package com.phillippitts.essaydefense.exception;

/**
 * Thrown when a submitted essay exceeds the configured maximum length.
 * Carries both the limit and the actual length so the portal can tell the student by how much.
 */
public class EssayTooLongException extends EssayDefenseException {

    private final int maxLength;
    private final int actualLength;

    public EssayTooLongException(int maxLength, int actualLength) {
        super("Essay exceeds maximum length (" + actualLength + " > " + maxLength + " characters)");
        this.maxLength = maxLength;
        this.actualLength = actualLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public int getActualLength() {
        return actualLength;
    }
}
