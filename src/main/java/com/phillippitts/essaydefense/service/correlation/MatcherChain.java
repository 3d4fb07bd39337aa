package com.phillippitts.essaydefense.service.correlation;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.service.correlation.impl.ConversationIdMatcher;
import com.phillippitts.essaydefense.service.correlation.impl.MostRecentOpenMatcher;
import com.phillippitts.essaydefense.service.correlation.impl.SessionIdMatcher;
import com.phillippitts.essaydefense.service.correlation.impl.StudentNameMatcher;
import com.phillippitts.essaydefense.store.SubmissionStore;

import java.util.List;
import java.util.Optional;

/**
 * Ordered correlation fallback chain. The first matcher that finds a submission wins.
 *
 * @param matchers matchers, strongest first
 */
public record MatcherChain(List<SubmissionMatcher> matchers) {

    /**
     * A resolved submission together with the matcher that found it.
     */
    public record Resolution(Submission submission, MatchMethod method) {}

    public MatcherChain {
        if (matchers == null || matchers.isEmpty()) {
            throw new IllegalArgumentException("at least one matcher required");
        }
        matchers = List.copyOf(matchers);
    }

    /**
     * Session id, conversation id, student name, most recent open submission.
     */
    public static MatcherChain defaultChain() {
        return new MatcherChain(List.of(
                new SessionIdMatcher(),
                new ConversationIdMatcher(),
                new StudentNameMatcher(),
                new MostRecentOpenMatcher()));
    }

    public Optional<Resolution> resolve(TranscriptEvent event, SubmissionStore store) {
        for (SubmissionMatcher matcher : matchers) {
            Optional<Submission> found = matcher.match(event, store);
            if (found.isPresent()) {
                return Optional.of(new Resolution(found.get(), matcher.method()));
            }
        }
        return Optional.empty();
    }
}
