package com.phillippitts.essaydefense.service.correlation.impl;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.service.correlation.MatchMethod;
import com.phillippitts.essaydefense.service.correlation.SubmissionMatcher;
import com.phillippitts.essaydefense.service.correlation.TranscriptEvent;
import com.phillippitts.essaydefense.store.SubmissionStore;

import java.util.Optional;

/**
 * Matches on the correlation token the provider echoes back. Any status matches; a submission past
 * its defense turns the event into a duplicate rather than letting a weaker matcher pick another one.
 */
public final class SessionIdMatcher implements SubmissionMatcher {

    @Override
    public Optional<Submission> match(TranscriptEvent event, SubmissionStore store) {
        return store.findBySessionId(event.claimedSessionId());
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.SESSION_ID;
    }
}
