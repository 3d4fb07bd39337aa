package com.phillippitts.essaydefense.service.correlation.impl;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.service.correlation.MatchMethod;
import com.phillippitts.essaydefense.service.correlation.TranscriptEvent;

import java.util.List;
import java.util.Optional;

/**
 * Last resort: the newest submission still waiting for a transcript, whoever it belongs to.
 * Risks a wrong match but never loses a transcript.
 */
public final class MostRecentOpenMatcher extends AbstractOpenSubmissionMatcher {

    @Override
    protected Optional<Submission> doMatch(TranscriptEvent event, List<Submission> openNewestFirst) {
        return Optional.of(openNewestFirst.get(0));
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.MOST_RECENT;
    }
}
