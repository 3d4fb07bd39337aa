package com.phillippitts.essaydefense.service.grading;

import com.phillippitts.essaydefense.config.logging.MdcFilter;
import com.phillippitts.essaydefense.config.properties.ExternalCallProperties;
import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.exception.EssayDefenseException;
import com.phillippitts.essaydefense.exception.ExternalServiceException;
import com.phillippitts.essaydefense.exception.GradingException;
import com.phillippitts.essaydefense.exception.IllegalStatusTransitionException;
import com.phillippitts.essaydefense.exception.SubmissionNotFoundException;
import com.phillippitts.essaydefense.service.external.BoundedCallExecutor;
import com.phillippitts.essaydefense.service.metrics.DefenseMetrics;
import com.phillippitts.essaydefense.store.SubmissionStore;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Grades finished defenses and stores the result.
 *
 * <p>The grading AI call happens outside the store lock. The status is checked again inside the
 * atomic update, so a submission the operator excluded while the call was in flight keeps its
 * new status and the grade is discarded with an {@link IllegalStatusTransitionException}.
 */
@Service
public class GradingService {

    private static final Logger LOG = LogManager.getLogger(GradingService.class);

    static final String SERVICE_NAME = "grading-ai";

    private final SubmissionStore store;
    private final GradingClient client;
    private final GradingResponseParser parser;
    private final RubricProvider rubricProvider;
    private final BoundedCallExecutor callExecutor;
    private final DefenseMetrics metrics;
    private final Clock clock;
    private final long timeoutMs;

    public GradingService(SubmissionStore store,
                          GradingClient client,
                          GradingResponseParser parser,
                          RubricProvider rubricProvider,
                          BoundedCallExecutor callExecutor,
                          DefenseMetrics metrics,
                          ExternalCallProperties callProperties,
                          Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.client = Objects.requireNonNull(client);
        this.parser = Objects.requireNonNull(parser);
        this.rubricProvider = Objects.requireNonNull(rubricProvider);
        this.callExecutor = Objects.requireNonNull(callExecutor);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
        this.timeoutMs = callProperties.getGradingTimeoutMs();
    }

    /**
     * Grades one submission: {@code DEFENSE_COMPLETE → GRADED}.
     *
     * @return the graded submission
     * @throws SubmissionNotFoundException       if no such submission
     * @throws IllegalStatusTransitionException  if it is not (or no longer) DEFENSE_COMPLETE
     * @throws GradingException                  if it has no transcript
     * @throws ExternalServiceException          if the grading AI fails after retries
     */
    public Submission grade(String sessionId) {
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put(MdcFilter.SESSION_ID, sessionId)) {
            Submission submission = store.findBySessionId(sessionId)
                    .orElseThrow(() -> new SubmissionNotFoundException(sessionId));
            if (submission.status() != SubmissionStatus.DEFENSE_COMPLETE) {
                throw new IllegalStatusTransitionException(sessionId, submission.status(), SubmissionStatus.GRADED);
            }
            if (!submission.hasTranscript()) {
                throw new GradingException(sessionId, "No transcript available");
            }

            String prompt = GradingPrompt.build(rubricProvider.rubric(), submission);
            String answer = callExecutor.callOrThrow(SERVICE_NAME, timeoutMs, () -> client.complete(prompt));
            GradingResult result = parser.parse(answer);
            metrics.recordGradingParse(result.method().name());

            AtomicBoolean applied = new AtomicBoolean(false);
            Submission graded = store.update(sessionId, current -> {
                if (current.status() != SubmissionStatus.DEFENSE_COMPLETE) {
                    applied.set(false);
                    return current;
                }
                applied.set(true);
                return current.toBuilder()
                        .status(SubmissionStatus.GRADED)
                        .grade(result.multiplier())
                        .gradeComments(result.comments())
                        .integrityFlag(result.integrityFlag())
                        .gradedAt(clock.instant())
                        .build();
            });
            if (!applied.get()) {
                LOG.warn("Status changed to {} while grading, result discarded", graded.status());
                throw new IllegalStatusTransitionException(sessionId, graded.status(), SubmissionStatus.GRADED);
            }
            LOG.info("Graded: multiplier={} integrityFlag={} method={}", result.multiplier(),
                    result.integrityFlag(), result.method());
            return graded;
        }
    }

    /**
     * Grades every DEFENSE_COMPLETE submission. Failures are collected per submission and never stop
     * the batch; running it twice grades nothing new the second time.
     */
    public BatchGradingSummary gradeAllEligible() {
        List<Submission> eligible = store.findByStatus(EnumSet.of(SubmissionStatus.DEFENSE_COMPLETE));
        int excluded = store.findByStatus(EnumSet.of(SubmissionStatus.EXCLUDED)).size();
        List<String> graded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (Submission s : eligible) {
            if (Thread.currentThread().isInterrupted()) {
                LOG.warn("Batch grading interrupted after {} submissions", graded.size() + failed.size());
                break;
            }
            try {
                grade(s.sessionId());
                graded.add(s.sessionId());
            } catch (EssayDefenseException e) {
                LOG.warn("Grading failed for {}: {}", s.sessionId(), e.getMessage());
                failed.add(s.sessionId());
            }
        }
        LOG.info("Batch grading finished: graded={}, failed={}, skippedExcluded={}",
                graded.size(), failed.size(), excluded);
        return new BatchGradingSummary(graded, failed, excluded);
    }
}
