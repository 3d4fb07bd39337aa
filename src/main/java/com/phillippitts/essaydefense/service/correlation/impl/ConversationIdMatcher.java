package com.phillippitts.essaydefense.service.correlation.impl;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.service.correlation.MatchMethod;
import com.phillippitts.essaydefense.service.correlation.SubmissionMatcher;
import com.phillippitts.essaydefense.service.correlation.TranscriptEvent;
import com.phillippitts.essaydefense.store.SubmissionStore;

import java.util.Optional;

/**
 * Matches on a conversation id already owned by a submission, either recorded when the defense
 * started or by an earlier delivery of the same conversation.
 */
public final class ConversationIdMatcher implements SubmissionMatcher {

    @Override
    public Optional<Submission> match(TranscriptEvent event, SubmissionStore store) {
        return store.findByConversationId(event.conversationId());
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.CONVERSATION_ID;
    }
}
