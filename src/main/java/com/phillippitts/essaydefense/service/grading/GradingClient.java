package com.phillippitts.essaydefense.service.grading;

/**
 * Sends a grading prompt to the grading AI and returns its free-text answer.
 *
 * <p>Implementations block for the duration of one request and throw on transport or protocol
 * failures. Callers bound and retry them through
 * {@link com.phillippitts.essaydefense.service.external.BoundedCallExecutor}.
 */
public interface GradingClient {

    /**
     * @param prompt full grading prompt (rubric, essay, transcript)
     * @return the model's answer text, never null
     */
    String complete(String prompt);
}
