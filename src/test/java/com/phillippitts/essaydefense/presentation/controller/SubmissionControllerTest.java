package com.phillippitts.essaydefense.presentation.controller;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.exception.EssayTooLongException;
import com.phillippitts.essaydefense.exception.SubmissionNotFoundException;
import com.phillippitts.essaydefense.service.correlation.CorrelationEngine;
import com.phillippitts.essaydefense.service.intake.SubmissionReceipt;
import com.phillippitts.essaydefense.service.intake.SubmissionService;
import com.phillippitts.essaydefense.testutil.Submissions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = SubmissionController.class)
@TestPropertySource(properties = "defense.recovery.enabled=false")
class SubmissionControllerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T09:00:00Z");

    @Autowired MockMvc mvc;
    @MockBean SubmissionService submissions;
    @MockBean CorrelationEngine correlation;

    @Test
    void intakeReturnsCreatedWithQuestionsAndPrompt() throws Exception {
        Submission s = Submissions.submitted("s1", "Jane Doe", T0);
        when(submissions.submit("Jane Doe", "My essay.")).thenReturn(new SubmissionReceipt(s, List.of()));

        mvc.perform(post("/api/submissions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentName\":\"Jane Doe\",\"essayText\":\"My essay.\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value("s1"))
                .andExpect(jsonPath("$.selectedQuestions.length()").value(2))
                .andExpect(jsonPath("$.selectedQuestions[0].id").value("c1"))
                .andExpect(jsonPath("$.firstMessage").value("Hello Jane Doe"))
                .andExpect(jsonPath("$.warnings").isEmpty());
    }

    @Test
    void tooLongEssayIsRejected() throws Exception {
        when(submissions.submit(anyString(), anyString())).thenThrow(new EssayTooLongException(10, 11));

        mvc.perform(post("/api/submissions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentName\":\"Jane\",\"essayText\":\"xxxxxxxxxxx\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("EssayTooLongException"));
    }

    @Test
    void lookupReturnsStatusName() throws Exception {
        when(submissions.get("s1")).thenReturn(Submissions.submitted("s1", "Jane Doe", T0));

        mvc.perform(get("/api/submissions/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.studentName").value("Jane Doe"));
    }

    @Test
    void unknownSessionIs404() throws Exception {
        when(submissions.get("nope")).thenThrow(new SubmissionNotFoundException("nope"));

        mvc.perform(get("/api/submissions/nope")).andExpect(status().isNotFound());
    }

    @Test
    void defenseStartWithoutBodyPassesNoConversation() throws Exception {
        Submission started = Submissions.submitted("s1", "Jane Doe", T0).toBuilder()
                .status(SubmissionStatus.DEFENSE_STARTED).defenseStartedAt(T0).build();
        when(correlation.markDefenseStarted(anyString(), isNull())).thenReturn(started);

        mvc.perform(post("/api/submissions/s1/defense-started"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEFENSE_STARTED"));

        verify(correlation).markDefenseStarted("s1", null);
    }

    @Test
    void defenseStartRecordsConversationId() throws Exception {
        Submission started = Submissions.submitted("s1", "Jane Doe", T0).toBuilder()
                .status(SubmissionStatus.DEFENSE_STARTED).conversationId("conv-1").build();
        when(correlation.markDefenseStarted("s1", "conv-1")).thenReturn(started);

        mvc.perform(post("/api/submissions/s1/defense-started").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":\"conv-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversationId").value("conv-1"));
    }
}
