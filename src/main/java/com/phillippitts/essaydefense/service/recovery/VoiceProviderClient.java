package com.phillippitts.essaydefense.service.recovery;

import java.util.List;

/**
 * Read access to finished conversations at the voice provider.
 *
 * <p>Implementations block and may throw on transport failures; the recovery sweep bounds and
 * retries each call on its own. Provider answers (unknown conversation, unfinished conversation)
 * are returned as {@link FetchResult}s rather than thrown.
 */
public interface VoiceProviderClient {

    FetchResult fetchByConversationId(String conversationId);

    /**
     * Ids of the agent's most recent conversations, newest first. One request; details are fetched
     * separately with {@link #fetchByConversationId}.
     */
    List<String> listRecentConversationIds();
}
