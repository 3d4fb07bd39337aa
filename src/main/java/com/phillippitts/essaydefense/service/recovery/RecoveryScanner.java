package com.phillippitts.essaydefense.service.recovery;

import com.phillippitts.essaydefense.config.logging.MdcFilter;
import com.phillippitts.essaydefense.config.properties.ExternalCallProperties;
import com.phillippitts.essaydefense.config.properties.RecoveryProperties;
import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.exception.EssayDefenseException;
import com.phillippitts.essaydefense.service.correlation.CorrelationEngine;
import com.phillippitts.essaydefense.service.correlation.CorrelationOutcome;
import com.phillippitts.essaydefense.service.correlation.TranscriptEvent;
import com.phillippitts.essaydefense.service.external.BoundedCallExecutor;
import com.phillippitts.essaydefense.service.external.CallResult;
import com.phillippitts.essaydefense.service.metrics.DefenseMetrics;
import com.phillippitts.essaydefense.store.SubmissionStore;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pulls transcripts the webhook never delivered.
 *
 * <p><b>Selection:</b> SUBMITTED or DEFENSE_STARTED submissions created more than the grace window
 * ago and less than the lookback window ago. Younger ones may still be talking; older ones are
 * abandoned.
 *
 * <p><b>Lookup:</b> by conversation id when one was reported at defense start, otherwise by the
 * session id correlation token, matched against the agent's recent conversations. The listing is
 * requested once per sweep and every provider request is its own bounded call with retry. Found transcripts are
 * applied through {@link CorrelationEngine#applyRecovered}, so a webhook racing the sweep is
 * harmless.
 *
 * <p><b>Re-entrancy:</b> sweeps share no state. Two sweeps at once may look up the same
 * submission; the store's per-session atomicity lets only one apply. An interrupt stops the sweep
 * between records and the summary reports it as aborted.
 */
@Component
public class RecoveryScanner {

    private static final Logger LOG = LogManager.getLogger(RecoveryScanner.class);

    static final String SERVICE_NAME = "voice-provider";

    /** Per-submission result of a sweep. */
    enum RecordResult { RECOVERED, NOT_FOUND, IN_PROGRESS, FAILED, SKIPPED }

    private final SubmissionStore store;
    private final VoiceProviderClient client;
    private final CorrelationEngine engine;
    private final BoundedCallExecutor callExecutor;
    private final RecoveryProperties properties;
    private final DefenseMetrics metrics;
    private final Clock clock;
    private final long timeoutMs;

    public RecoveryScanner(SubmissionStore store,
                           VoiceProviderClient client,
                           CorrelationEngine engine,
                           BoundedCallExecutor callExecutor,
                           RecoveryProperties properties,
                           ExternalCallProperties callProperties,
                           DefenseMetrics metrics,
                           Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.client = Objects.requireNonNull(client);
        this.engine = Objects.requireNonNull(engine);
        this.callExecutor = Objects.requireNonNull(callExecutor);
        this.properties = Objects.requireNonNull(properties);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
        this.timeoutMs = callProperties.getVoiceTimeoutMs();
    }

    @Scheduled(fixedDelayString = "${defense.recovery.interval-ms:300000}",
            initialDelayString = "${defense.recovery.initial-delay-ms:60000}")
    public void scheduledSweep() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            RecoverySummary s = sweep();
            if (s.examined() > 0) {
                LOG.info("Scheduled recovery sweep: {}", s);
            }
        } catch (RuntimeException e) {
            LOG.error("Scheduled recovery sweep failed", e);
        }
    }

    /**
     * Runs one sweep over the current candidates.
     */
    public RecoverySummary sweep() {
        List<Submission> candidates = candidates(clock.instant());
        ConversationScan scan = new ConversationScan();
        int recovered = 0;
        int notFound = 0;
        int inProgress = 0;
        int failed = 0;
        int examined = 0;
        boolean aborted = false;

        for (Submission s : candidates) {
            if (Thread.currentThread().isInterrupted()) {
                aborted = true;
                LOG.warn("Recovery sweep interrupted after {} of {} submissions", examined, candidates.size());
                break;
            }
            examined++;
            RecordResult result;
            try (CloseableThreadContext.Instance ctc =
                         CloseableThreadContext.put(MdcFilter.SESSION_ID, s.sessionId())) {
                result = recover(s, scan);
            }
            switch (result) {
                case RECOVERED -> recovered++;
                case NOT_FOUND -> notFound++;
                case IN_PROGRESS -> inProgress++;
                case FAILED -> failed++;
                case SKIPPED -> { }
            }
            metrics.recordRecovery(result.name());
        }
        return new RecoverySummary(examined, recovered, notFound, inProgress, failed, aborted);
    }

    List<Submission> candidates(Instant now) {
        Instant youngest = now.minus(properties.graceWindow());
        Instant oldest = now.minus(properties.lookbackWindow());
        return store.findByStatus(SubmissionStatus.AWAITING_TRANSCRIPT).stream()
                .filter(s -> s.createdAt().isBefore(youngest) && s.createdAt().isAfter(oldest))
                .toList();
    }

    private RecordResult recover(Submission s, ConversationScan scan) {
        FetchResult fetched = s.conversationId() != null
                ? fetchConversation(s.conversationId())
                : scan.findByToken(s.sessionId());
        return switch (fetched.outcome()) {
            case NOT_FOUND -> {
                LOG.debug("No conversation yet: {}", fetched.detail());
                yield RecordResult.NOT_FOUND;
            }
            case IN_PROGRESS -> {
                LOG.debug("Conversation not finished: {}", fetched.detail());
                yield RecordResult.IN_PROGRESS;
            }
            case ERROR -> {
                LOG.warn("Lookup error: {}", fetched.detail());
                yield RecordResult.FAILED;
            }
            case FOUND -> apply(s.sessionId(), fetched.event());
        };
    }

    private RecordResult apply(String sessionId, TranscriptEvent event) {
        try {
            CorrelationOutcome outcome = engine.applyRecovered(sessionId, event);
            return switch (outcome.status()) {
                case MATCHED -> {
                    LOG.info("Recovered transcript, status now {}", outcome.submissionStatus());
                    yield RecordResult.RECOVERED;
                }
                case DUPLICATE_IGNORED -> RecordResult.SKIPPED;
                default -> RecordResult.FAILED;
            };
        } catch (EssayDefenseException e) {
            LOG.warn("Could not apply recovered transcript: {}", e.getMessage());
            return RecordResult.FAILED;
        }
    }

    /**
     * One bounded lookup; exhausted attempts come back as {@link FetchResult.Outcome#ERROR}.
     */
    private FetchResult fetchConversation(String conversationId) {
        CallResult<FetchResult> call = callExecutor.call(SERVICE_NAME, timeoutMs,
                () -> client.fetchByConversationId(conversationId));
        if (!call.isSuccess()) {
            return FetchResult.error("conversation " + conversationId + ": " + call.outcome()
                    + " after " + call.attempts() + " attempts");
        }
        return call.value();
    }

    /**
     * Token lookups for one sweep. The recent-conversation listing is requested at most once, and
     * each conversation detail at most once, however many submissions lack a conversation id.
     * Conversations already owned by a submission are not fetched.
     */
    private final class ConversationScan {

        private CallResult<List<String>> listing;
        private final Map<String, FetchResult> byToken = new HashMap<>();
        private int cursor;
        private int unreadable;

        FetchResult findByToken(String sessionId) {
            if (listing == null) {
                listing = callExecutor.call(SERVICE_NAME, timeoutMs, client::listRecentConversationIds);
            }
            if (!listing.isSuccess()) {
                return FetchResult.error("conversation listing: " + listing.outcome()
                        + " after " + listing.attempts() + " attempts");
            }
            FetchResult known = byToken.get(sessionId);
            if (known != null) {
                return known;
            }
            List<String> ids = listing.value();
            while (cursor < ids.size()) {
                String id = ids.get(cursor++);
                if (store.findByConversationId(id).isPresent()) {
                    continue;
                }
                FetchResult detail = fetchConversation(id);
                if (detail.outcome() == FetchResult.Outcome.ERROR) {
                    unreadable++;
                    LOG.warn("Skipping unreadable conversation: {}", detail.detail());
                    continue;
                }
                String token = detail.event() == null ? null : detail.event().claimedSessionId();
                if (token == null) {
                    continue;
                }
                // listing is newest first, so the first conversation seen for a token wins
                byToken.putIfAbsent(token, detail);
                if (token.equals(sessionId)) {
                    return byToken.get(sessionId);
                }
            }
            if (unreadable > 0) {
                return FetchResult.error(unreadable + " recent conversation(s) could not be read");
            }
            return FetchResult.notFound("no recent conversation carries session " + sessionId);
        }
    }
}
