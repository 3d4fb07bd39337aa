package com.phillippitts.essaydefense;

import com.phillippitts.essaydefense.service.grading.GradingClient;
import com.phillippitts.essaydefense.service.recovery.VoiceProviderClient;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("integration")
@AutoConfigureMockMvc
@SpringBootTest(
    properties = {
        "defense.webhook.secret=it-secret",
        "defense.recovery.enabled=false" // no scheduled calls to the voice provider
    }
)
class EssayDefenseApplicationTests {

    @Autowired MockMvc mvc;
    @MockBean GradingClient gradingClient;
    @MockBean VoiceProviderClient voiceProvider;

    @Test
    void contextLoads() {
    }

    @Test
    void essayIsDefendedAndGraded() throws Exception {
        MvcResult created = mvc.perform(post("/api/submissions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentName\":\"Jane Doe\",\"essayText\":\"Tides are shaped by the moon.\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.selectedQuestions.length()").value(5))
                .andReturn();
        String sessionId = new JSONObject(created.getResponse().getContentAsString()).getString("sessionId");

        String webhook = new JSONObject()
                .put("conversation_id", "conv-it-1")
                .put("session_id", sessionId)
                .put("call_duration_secs", 240)
                .put("transcript", new JSONArray()
                        .put(new JSONObject().put("role", "agent").put("message", "What is your thesis?"))
                        .put(new JSONObject().put("role", "user").put("message", "The moon drives tides.")))
                .toString();
        mvc.perform(post("/api/webhooks/transcript").param("secret", "it-secret")
                        .contentType(MediaType.APPLICATION_JSON).content(webhook))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("MATCHED"));

        when(gradingClient.complete(anyString())).thenReturn("""
                Thesis score: 4
                Evidence score: 4
                Understanding score: 3
                Communication score: 4
                Final multiplier: 1.03
                Integrity flag: no
                Comments: Clear and well supported.
                """);
        mvc.perform(post("/api/admin/submissions/{id}/grade", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("GRADED"))
                .andExpect(jsonPath("$.grade").value(1.03))
                .andExpect(jsonPath("$.integrityFlag").value(false));

        mvc.perform(get("/api/submissions/{id}", sessionId))
                .andExpect(jsonPath("$.transcript")
                        .value("EXAMINER: What is your thesis?\n\nSTUDENT: The moon drives tides."));

        verifyNoInteractions(voiceProvider);
    }

    @Test
    void healthReportsPendingSubmissions() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.pendingSubmissions.details.recoveryEnabled").value(false));
    }
}
