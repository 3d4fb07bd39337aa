package com.phillippitts.essaydefense.presentation.controller;

import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.service.correlation.CorrelationEngine;
import com.phillippitts.essaydefense.service.correlation.CorrelationOutcome;
import com.phillippitts.essaydefense.service.correlation.MatchMethod;
import com.phillippitts.essaydefense.service.correlation.TranscriptEvent;
import com.phillippitts.essaydefense.service.correlation.WebhookAuthenticator;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = WebhookController.class)
@Import(WebhookAuthenticator.class)
@TestPropertySource(properties = {"defense.webhook.secret=testsecret", "defense.recovery.enabled=false"})
class WebhookControllerTest {

    private static final String FLAT = """
            {"conversation_id": "conv-1", "session_id": "s1", "call_duration_secs": 120,
             "transcript": [{"role": "agent", "message": "Hi"}, {"role": "user", "message": "I'm Jane"}]}
            """;

    @Autowired MockMvc mvc;
    @MockBean CorrelationEngine correlation;

    @Test
    void wrongSecretIsRejectedWithoutTouchingAnything() throws Exception {
        mvc.perform(post("/api/webhooks/transcript").param("secret", "nope")
                        .contentType(MediaType.APPLICATION_JSON).content(FLAT))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("WebhookAuthenticationException"));

        verifyNoInteractions(correlation);
    }

    @Test
    void missingSecretIsRejected() throws Exception {
        mvc.perform(post("/api/webhooks/transcript").contentType(MediaType.APPLICATION_JSON).content(FLAT))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(correlation);
    }

    @Test
    void matchedTranscriptAnswersOk() throws Exception {
        when(correlation.correlate(any())).thenReturn(new CorrelationOutcome(CorrelationOutcome.Status.MATCHED,
                "s1", MatchMethod.SESSION_ID, SubmissionStatus.DEFENSE_COMPLETE));

        mvc.perform(post("/api/webhooks/transcript").param("secret", "testsecret")
                        .contentType(MediaType.APPLICATION_JSON).content(FLAT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("MATCHED"))
                .andExpect(jsonPath("$.sessionId").value("s1"));

        ArgumentCaptor<TranscriptEvent> captor = ArgumentCaptor.forClass(TranscriptEvent.class);
        verify(correlation).correlate(captor.capture());
        assertThat(captor.getValue().claimedSessionId()).isEqualTo("s1");
        assertThat(captor.getValue().callDurationSeconds()).isEqualTo(120);
        assertThat(captor.getValue().turns()).hasSize(2);
    }

    @Test
    void duplicateAnswersOk() throws Exception {
        when(correlation.correlate(any())).thenReturn(new CorrelationOutcome(
                CorrelationOutcome.Status.DUPLICATE_IGNORED, "s1", MatchMethod.SESSION_ID, SubmissionStatus.GRADED));

        mvc.perform(post("/api/webhooks/transcript").param("secret", "testsecret")
                        .contentType(MediaType.APPLICATION_JSON).content(FLAT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DUPLICATE_IGNORED"));
    }

    @Test
    void unmatchedAnswersUnprocessable() throws Exception {
        when(correlation.correlate(any())).thenReturn(CorrelationOutcome.noMatch());

        mvc.perform(post("/api/webhooks/transcript").param("secret", "testsecret")
                        .contentType(MediaType.APPLICATION_JSON).content(FLAT))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value("NO_MATCH"));
    }

    @Test
    void conflictAnswersConflict() throws Exception {
        when(correlation.correlate(any())).thenReturn(new CorrelationOutcome(CorrelationOutcome.Status.CONFLICT,
                "s1", MatchMethod.SESSION_ID, SubmissionStatus.SUBMITTED));

        mvc.perform(post("/api/webhooks/transcript").param("secret", "testsecret")
                        .contentType(MediaType.APPLICATION_JSON).content(FLAT))
                .andExpect(status().isConflict());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mvc.perform(post("/api/webhooks/transcript").param("secret", "testsecret")
                        .contentType(MediaType.APPLICATION_JSON).content("[1,2"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(correlation);
    }
}
