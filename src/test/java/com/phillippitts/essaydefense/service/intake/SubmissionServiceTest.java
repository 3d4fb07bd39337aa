package com.phillippitts.essaydefense.service.intake;

import com.phillippitts.essaydefense.config.properties.DefenseProperties;
import com.phillippitts.essaydefense.domain.Question;
import com.phillippitts.essaydefense.domain.QuestionCategory;
import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.exception.EssayTooLongException;
import com.phillippitts.essaydefense.exception.InvalidSubmissionException;
import com.phillippitts.essaydefense.exception.SubmissionNotFoundException;
import com.phillippitts.essaydefense.service.prompt.PromptComposer;
import com.phillippitts.essaydefense.service.questions.QuestionBank;
import com.phillippitts.essaydefense.service.questions.QuestionSelector;
import com.phillippitts.essaydefense.store.InMemorySubmissionStore;
import com.phillippitts.essaydefense.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T09:00:00Z");

    private InMemorySubmissionStore store;
    private DefenseProperties properties;
    private SubmissionService service;

    @BeforeEach
    void setUp() {
        store = new InMemorySubmissionStore();
        properties = new DefenseProperties();
        properties.setMaxEssayLength(100);
        properties.setContentQuestionCount(2);
        properties.setProcessQuestionCount(1);
        QuestionBank bank = new QuestionBank(List.of(
                new Question("c1", QuestionCategory.CONTENT, "Thesis?"),
                new Question("c2", QuestionCategory.CONTENT, "Evidence?"),
                new Question("c3", QuestionCategory.CONTENT, "Counterargument?"),
                new Question("p1", QuestionCategory.PROCESS, "Research?"),
                new Question("p2", QuestionCategory.PROCESS, "Revision?")));
        PromptComposer composer = new PromptComposer((kind, name) -> Optional.empty());
        service = new SubmissionService(store, new QuestionSelector(bank, new Random(7)), composer, properties,
                new MutableClock(T0));
    }

    @Test
    void acceptedEssayIsStoredAsSubmitted() {
        SubmissionReceipt receipt = service.submit("  Jane Doe  ", "A short essay.");

        Submission s = receipt.submission();
        assertThat(s.status()).isEqualTo(SubmissionStatus.SUBMITTED);
        assertThat(s.studentName()).isEqualTo("Jane Doe");
        assertThat(s.createdAt()).isEqualTo(T0);
        assertThat(s.selectedQuestions().content()).hasSize(2);
        assertThat(s.selectedQuestions().process()).hasSize(1);
        assertThat(s.composedPrompt()).contains("STUDENT NAME: Jane Doe").contains("A short essay.");
        assertThat(s.firstMessage()).contains("Jane Doe");
        assertThat(store.findBySessionId(s.sessionId())).contains(s);
        assertThat(service.get(s.sessionId())).isEqualTo(s);
    }

    @Test
    void missingTemplatesProduceWarningsNotFailures() {
        SubmissionReceipt receipt = service.submit("Sam", "Essay.");

        assertThat(receipt.warnings()).isNotEmpty();
        assertThat(receipt.submission().composedPrompt()).isNotBlank();
    }

    @Test
    void sessionIdsAreUnique() {
        String a = service.submit("A", "Essay one.").submission().sessionId();
        String b = service.submit("A", "Essay one.").submission().sessionId();

        assertThat(a).isNotEqualTo(b);
        assertThat(store.findAll()).hasSize(2);
    }

    @Test
    void essayAtTheLimitIsAccepted() {
        assertThat(service.submit("Max", "x".repeat(100)).submission().essayText()).hasSize(100);
    }

    @Test
    void essayOverTheLimitIsRejectedAndNothingStored() {
        assertThatThrownBy(() -> service.submit("Max", "x".repeat(101)))
                .isInstanceOf(EssayTooLongException.class)
                .satisfies(e -> assertThat(((EssayTooLongException) e).getActualLength()).isEqualTo(101));
        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void blankFieldsAreRejected() {
        assertThatThrownBy(() -> service.submit(" ", "Essay."))
                .isInstanceOf(InvalidSubmissionException.class)
                .satisfies(e -> assertThat(((InvalidSubmissionException) e).getField()).isEqualTo("studentName"));
        assertThatThrownBy(() -> service.submit("Jane", null))
                .isInstanceOf(InvalidSubmissionException.class)
                .satisfies(e -> assertThat(((InvalidSubmissionException) e).getField()).isEqualTo("essayText"));
        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void unknownSessionIsNotFound() {
        assertThatThrownBy(() -> service.get("nope")).isInstanceOf(SubmissionNotFoundException.class);
    }
}
