package com.phillippitts.essaydefense.service.correlation;

/**
 * How a transcript was tied to its submission, strongest first.
 */
public enum MatchMethod {
    /** Correlation token equals the submission's session id. */
    SESSION_ID,
    /** Conversation id was already recorded on the submission at defense start. */
    CONVERSATION_ID,
    /** Student introduced themselves with a name that matches an open submission. */
    STUDENT_NAME,
    /** Last resort: newest open submission. */
    MOST_RECENT,
    /** Recovery sweep fetched the transcript for a known submission. */
    RECOVERY,
    NONE
}
