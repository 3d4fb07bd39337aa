package com.phillippitts.essaydefense.service.correlation.impl;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.service.correlation.SubmissionMatcher;
import com.phillippitts.essaydefense.service.correlation.TranscriptEvent;
import com.phillippitts.essaydefense.store.SubmissionStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Base class for heuristic matchers that only consider submissions still waiting for a transcript.
 *
 * <p>Template method: {@link #match} loads the open submissions newest first and hands them to
 * {@link #doMatch}. With no open submissions the subclass is not called.
 *
 * <p>"Newest" is creation timestamp order; ties are broken by session id so the choice is stable.
 */
public abstract class AbstractOpenSubmissionMatcher implements SubmissionMatcher {

    static final Comparator<Submission> NEWEST_FIRST =
            Comparator.comparing(Submission::createdAt)
                    .thenComparing(Submission::sessionId)
                    .reversed();

    @Override
    public final Optional<Submission> match(TranscriptEvent event, SubmissionStore store) {
        List<Submission> open = store.findByStatus(SubmissionStatus.AWAITING_TRANSCRIPT).stream()
                .sorted(NEWEST_FIRST)
                .toList();
        if (open.isEmpty()) {
            return Optional.empty();
        }
        return doMatch(event, open);
    }

    /**
     * @param event transcript event
     * @param openNewestFirst open submissions, newest first, never empty
     * @return chosen submission, or empty to fall through
     */
    protected abstract Optional<Submission> doMatch(TranscriptEvent event, List<Submission> openNewestFirst);
}
