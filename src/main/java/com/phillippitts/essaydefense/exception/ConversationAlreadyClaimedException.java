package com.phillippitts.essaydefense.exception;

/**
 * Thrown by the store when an update would give a conversation id to a second submission.
 * The update is not applied.
 */
public class ConversationAlreadyClaimedException extends EssayDefenseException {

    private final String conversationId;
    private final String ownerSessionId;

    public ConversationAlreadyClaimedException(String conversationId, String ownerSessionId) {
        super("Conversation " + conversationId + " already belongs to session " + ownerSessionId);
        this.conversationId = conversationId;
        this.ownerSessionId = ownerSessionId;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getOwnerSessionId() {
        return ownerSessionId;
    }
}
