package com.phillippitts.essaydefense.service.correlation;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.store.SubmissionStore;

import java.util.Optional;

/**
 * One step of the correlation fallback chain.
 *
 * <p>Implementations of this interface are tried in order by {@link CorrelationEngine}; the first
 * one returning a submission wins.
 *
 * <ul>
 *   <li>{@link com.phillippitts.essaydefense.service.correlation.impl.SessionIdMatcher} -
 *       authoritative correlation token</li>
 *   <li>{@link com.phillippitts.essaydefense.service.correlation.impl.ConversationIdMatcher} -
 *       conversation id recorded at defense start</li>
 *   <li>{@link com.phillippitts.essaydefense.service.correlation.impl.StudentNameMatcher} -
 *       self-introduction in the transcript</li>
 *   <li>{@link com.phillippitts.essaydefense.service.correlation.impl.MostRecentOpenMatcher} -
 *       newest submission still waiting for a transcript</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> implementations must be stateless. They only read the store; the engine
 * performs the update under the store's per-session lock and re-checks status there.
 */
public interface SubmissionMatcher {

    /**
     * @param event inbound transcript event
     * @param store submission store (read only)
     * @return matching submission, or empty to fall through to the next matcher
     */
    Optional<Submission> match(TranscriptEvent event, SubmissionStore store);

    MatchMethod method();
}
