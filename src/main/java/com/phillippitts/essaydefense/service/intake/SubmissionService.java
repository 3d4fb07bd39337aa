package com.phillippitts.essaydefense.service.intake;

import com.phillippitts.essaydefense.config.properties.DefenseProperties;
import com.phillippitts.essaydefense.domain.SelectedQuestions;
import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.exception.EssayTooLongException;
import com.phillippitts.essaydefense.exception.InvalidSubmissionException;
import com.phillippitts.essaydefense.exception.SubmissionNotFoundException;
import com.phillippitts.essaydefense.service.prompt.ComposedPrompt;
import com.phillippitts.essaydefense.service.prompt.PromptComposer;
import com.phillippitts.essaydefense.service.questions.QuestionSelector;
import com.phillippitts.essaydefense.store.SubmissionStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Accepts essays and prepares their oral defense.
 *
 * <p>Intake validates the essay, freezes a random question set, renders the examiner prompt and
 * first message, mints the session id and stores the record as SUBMITTED. Validation fails closed:
 * nothing is stored for an invalid essay.
 */
@Service
public class SubmissionService {

    private static final Logger LOG = LogManager.getLogger(SubmissionService.class);

    private final SubmissionStore store;
    private final QuestionSelector selector;
    private final PromptComposer composer;
    private final DefenseProperties properties;
    private final Clock clock;

    public SubmissionService(SubmissionStore store,
                             QuestionSelector selector,
                             PromptComposer composer,
                             DefenseProperties properties,
                             Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.selector = Objects.requireNonNull(selector);
        this.composer = Objects.requireNonNull(composer);
        this.properties = Objects.requireNonNull(properties);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * @throws InvalidSubmissionException if name or essay is blank
     * @throws EssayTooLongException      if the essay exceeds {@code defense.max-essay-length}
     */
    public SubmissionReceipt submit(String studentName, String essayText) {
        if (studentName == null || studentName.isBlank()) {
            throw new InvalidSubmissionException("studentName", "must not be blank");
        }
        if (essayText == null || essayText.isBlank()) {
            throw new InvalidSubmissionException("essayText", "must not be blank");
        }
        if (essayText.length() > properties.getMaxEssayLength()) {
            throw new EssayTooLongException(properties.getMaxEssayLength(), essayText.length());
        }

        String name = studentName.trim();
        SelectedQuestions questions = selector.select(properties.getContentQuestionCount(),
                properties.getProcessQuestionCount());
        ComposedPrompt composed = composer.compose(name, essayText, questions,
                properties.getPersonalityTemplate(), properties.getFlowTemplate(),
                properties.getFirstMessageTemplate());

        Submission submission = Submission.create(UUID.randomUUID().toString(), name, essayText, questions,
                composed.prompt(), composed.firstMessage(), clock.instant());
        store.insert(submission);
        LOG.info("Accepted submission {} ({} chars, {} questions)", submission.sessionId(),
                essayText.length(), questions.size());
        return new SubmissionReceipt(submission, composed.warnings());
    }

    public Submission get(String sessionId) {
        return store.findBySessionId(sessionId).orElseThrow(() -> new SubmissionNotFoundException(sessionId));
    }
}
