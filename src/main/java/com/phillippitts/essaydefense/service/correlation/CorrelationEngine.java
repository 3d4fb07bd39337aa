package com.phillippitts.essaydefense.service.correlation;

import com.phillippitts.essaydefense.config.logging.MdcFilter;
import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.exception.ConversationAlreadyClaimedException;
import com.phillippitts.essaydefense.exception.SubmissionNotFoundException;
import com.phillippitts.essaydefense.service.correlation.event.TranscriptCorrelatedEvent;
import com.phillippitts.essaydefense.service.correlation.event.UnmatchedTranscriptEvent;
import com.phillippitts.essaydefense.service.exclusion.ExclusionPolicy;
import com.phillippitts.essaydefense.service.metrics.DefenseMetrics;
import com.phillippitts.essaydefense.store.SubmissionStore;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Attaches finished defense transcripts to their submissions.
 *
 * <p><b>Push path</b> ({@link #correlate}): the webhook's event is resolved through the
 * {@link MatcherChain} (session id, conversation id, student name, newest open submission) and then
 * applied. Nothing found gives {@link CorrelationOutcome.Status#NO_MATCH} and an
 * {@link UnmatchedTranscriptEvent} carrying the raw payload.
 *
 * <p><b>Pull path</b> ({@link #applyRecovered}): the recovery sweep already knows the submission and
 * applies the fetched transcript directly.
 *
 * <p><b>Idempotency:</b> both paths go through one update function that runs under the store's
 * per-session lock and checks the current status there. A submission that already holds its
 * transcript is left exactly as it is, so webhook and sweep may race freely: whichever arrives
 * first wins and the other becomes {@link CorrelationOutcome.Status#DUPLICATE_IGNORED}.
 *
 * <p><b>On apply:</b> transcript formatted as EXAMINER/STUDENT turns, {@code defenseStartedAt}
 * backfilled if the start was never reported, {@code defenseEndedAt} set, conversation id and
 * call duration stored, status set by {@link ExclusionPolicy}.
 */
@Service
public class CorrelationEngine {

    private static final Logger LOG = LogManager.getLogger(CorrelationEngine.class);

    private final SubmissionStore store;
    private final MatcherChain chain;
    private final ExclusionPolicy exclusionPolicy;
    private final ApplicationEventPublisher publisher;
    private final DefenseMetrics metrics;
    private final Clock clock;

    public CorrelationEngine(SubmissionStore store,
                             MatcherChain chain,
                             ExclusionPolicy exclusionPolicy,
                             ApplicationEventPublisher publisher,
                             DefenseMetrics metrics,
                             Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.exclusionPolicy = Objects.requireNonNull(exclusionPolicy, "exclusionPolicy");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Push path: resolves and applies a webhook-delivered transcript.
     *
     * @param event transcript event
     * @return outcome; never throws for an unmatched event
     */
    public CorrelationOutcome correlate(TranscriptEvent event) {
        Objects.requireNonNull(event, "event");
        Optional<MatcherChain.Resolution> resolution = chain.resolve(event, store);
        if (resolution.isEmpty()) {
            metrics.recordCorrelation(CorrelationOutcome.Status.NO_MATCH.name(), MatchMethod.NONE.name(), "push");
            publisher.publishEvent(new UnmatchedTranscriptEvent(event.conversationId(),
                    event.claimedSessionId(), event.rawPayload(), clock.instant()));
            return CorrelationOutcome.noMatch();
        }
        MatcherChain.Resolution r = resolution.get();
        if (r.method() != MatchMethod.SESSION_ID && event.claimedSessionId() != null) {
            LOG.warn("Claimed session {} unknown, resolved by {} to {}", event.claimedSessionId(),
                    r.method(), r.submission().sessionId());
        }
        return apply(r.submission().sessionId(), event, r.method(), "push");
    }

    /**
     * Pull path: applies a transcript the recovery sweep fetched for a known submission.
     *
     * @throws SubmissionNotFoundException if the submission does not exist
     */
    public CorrelationOutcome applyRecovered(String sessionId, TranscriptEvent event) {
        Objects.requireNonNull(event, "event");
        return apply(sessionId, event, MatchMethod.RECOVERY, "pull");
    }

    /**
     * Records that the voice session began: {@code SUBMITTED → DEFENSE_STARTED}. Later states are
     * untouched; a conversation id is stored if the submission has none yet.
     *
     * @return the submission after the update
     * @throws SubmissionNotFoundException if the submission does not exist
     * @throws ConversationAlreadyClaimedException if the conversation id belongs to another submission
     */
    public Submission markDefenseStarted(String sessionId, String conversationId) {
        String convId = conversationId == null || conversationId.isBlank() ? null : conversationId.trim();
        Instant now = clock.instant();
        return store.update(sessionId, current -> {
            Submission.Builder b = current.toBuilder();
            boolean changed = false;
            if (current.status() == SubmissionStatus.SUBMITTED) {
                b.status(SubmissionStatus.DEFENSE_STARTED).defenseStartedAt(now);
                changed = true;
            }
            if (convId != null && current.conversationId() == null && current.status().isAwaitingTranscript()) {
                b.conversationId(convId);
                changed = true;
            }
            return changed ? b.build() : current;
        });
    }

    private CorrelationOutcome apply(String sessionId, TranscriptEvent event, MatchMethod method, String path) {
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put(MdcFilter.SESSION_ID, sessionId)) {
            String transcript = TranscriptFormatter.format(event.turns());
            Instant now = clock.instant();
            AtomicBoolean duplicate = new AtomicBoolean(false);

            Submission after;
            try {
                after = store.update(sessionId, current -> {
                    if (current.status().hasTranscript()) {
                        duplicate.set(true);
                        return current;
                    }
                    duplicate.set(false);
                    return current.toBuilder()
                            .transcript(transcript)
                            .conversationId(event.conversationId() != null
                                    ? event.conversationId() : current.conversationId())
                            .callDurationSeconds(event.callDurationSeconds())
                            .defenseStartedAt(current.defenseStartedAt() != null ? current.defenseStartedAt() : now)
                            .defenseEndedAt(now)
                            .status(exclusionPolicy.statusAfterDefense(event.callDurationSeconds()))
                            .build();
                });
            } catch (ConversationAlreadyClaimedException e) {
                LOG.warn("Refusing transcript for {}: {}", sessionId, e.getMessage());
                metrics.recordCorrelation(CorrelationOutcome.Status.CONFLICT.name(), method.name(), path);
                SubmissionStatus status = store.findBySessionId(sessionId).map(Submission::status).orElse(null);
                return new CorrelationOutcome(CorrelationOutcome.Status.CONFLICT, sessionId, method, status);
            }

            if (duplicate.get()) {
                LOG.info("Duplicate transcript delivery ignored (status={}, method={})", after.status(), method);
                metrics.recordCorrelation(CorrelationOutcome.Status.DUPLICATE_IGNORED.name(), method.name(), path);
                return new CorrelationOutcome(CorrelationOutcome.Status.DUPLICATE_IGNORED, sessionId, method,
                        after.status());
            }

            metrics.recordCorrelation(CorrelationOutcome.Status.MATCHED.name(), method.name(), path);
            publisher.publishEvent(new TranscriptCorrelatedEvent(sessionId, after.conversationId(), method,
                    after.status(), now));
            if (after.status() == SubmissionStatus.EXCLUDED) {
                LOG.info("Call lasted {}s (< {}s), submission excluded from grading",
                        after.callDurationSeconds(), exclusionPolicy.getMinCallLengthSeconds());
            }
            return new CorrelationOutcome(CorrelationOutcome.Status.MATCHED, sessionId, method, after.status());
        }
    }
}
