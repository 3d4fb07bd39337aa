package com.phillippitts.essaydefense.presentation.controller;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.exception.ExternalServiceException;
import com.phillippitts.essaydefense.exception.IllegalStatusTransitionException;
import com.phillippitts.essaydefense.exception.InvalidSubmissionException;
import com.phillippitts.essaydefense.service.grading.BatchGradingSummary;
import com.phillippitts.essaydefense.service.grading.GradingService;
import com.phillippitts.essaydefense.service.recovery.RecoveryScanner;
import com.phillippitts.essaydefense.service.recovery.RecoverySummary;
import com.phillippitts.essaydefense.service.review.ReviewService;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AdminController.class)
@TestPropertySource(properties = "defense.recovery.enabled=false")
class AdminControllerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T09:00:00Z");

    @Autowired MockMvc mvc;
    @MockBean RecoveryScanner recovery;
    @MockBean GradingService grading;
    @MockBean ReviewService review;

    private static Submission withStatus(SubmissionStatus status) {
        return Submissions.submitted("s1", "Jane Doe", T0).toBuilder().status(status).build();
    }

    @Test
    void recoverySweepReturnsSummary() throws Exception {
        when(recovery.sweep()).thenReturn(new RecoverySummary(3, 1, 1, 0, 1, false));

        mvc.perform(post("/api/admin/recovery"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.examined").value(3))
                .andExpect(jsonPath("$.recovered").value(1))
                .andExpect(jsonPath("$.aborted").value(false));
    }

    @Test
    void batchGradingReturnsSummary() throws Exception {
        when(grading.gradeAllEligible()).thenReturn(new BatchGradingSummary(List.of("s1", "s2"), List.of("s3"), 4));

        mvc.perform(post("/api/admin/grading"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.graded.length()").value(2))
                .andExpect(jsonPath("$.failed[0]").value("s3"))
                .andExpect(jsonPath("$.skippedExcluded").value(4));
    }

    @Test
    void gradingOutageIs503() throws Exception {
        when(grading.grade("s1")).thenThrow(new ExternalServiceException("grading-ai call failed", "grading-ai", 2));

        mvc.perform(post("/api/admin/submissions/s1/grade"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.details").value("Please retry later"));
    }

    @Test
    void statusToggleAcceptsDisplayNames() throws Exception {
        when(review.overrideStatus("s1", SubmissionStatus.DEFENSE_COMPLETE))
                .thenReturn(withStatus(SubmissionStatus.DEFENSE_COMPLETE));

        mvc.perform(put("/api/admin/submissions/s1/status").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Defense Complete\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEFENSE_COMPLETE"));
    }

    @Test
    void unknownStatusIs400() throws Exception {
        mvc.perform(put("/api/admin/submissions/s1/status").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Pending\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(review);
    }

    @Test
    void illegalToggleIs409() throws Exception {
        when(review.overrideStatus("s1", SubmissionStatus.EXCLUDED)).thenThrow(
                new IllegalStatusTransitionException("s1", SubmissionStatus.GRADED, SubmissionStatus.EXCLUDED));

        mvc.perform(put("/api/admin/submissions/s1/status").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"excluded\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void reviewPassesNotesAndFinalGrade() throws Exception {
        when(review.markReviewed("s1", "Well argued.", 91.0)).thenReturn(withStatus(SubmissionStatus.REVIEWED));

        mvc.perform(put("/api/admin/submissions/s1/review").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instructorNotes\":\"Well argued.\",\"finalGrade\":91.0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REVIEWED"));

        verify(review).markReviewed("s1", "Well argued.", 91.0);
    }

    @Test
    void parseStatusNormalizesSpellings() {
        assertThat(AdminController.parseStatus("defense-complete")).isEqualTo(SubmissionStatus.DEFENSE_COMPLETE);
        assertThat(AdminController.parseStatus(" Excluded ")).isEqualTo(SubmissionStatus.EXCLUDED);
        assertThat(AdminController.parseStatus("DefenseComplete")).isEqualTo(SubmissionStatus.DEFENSE_COMPLETE);
        assertThatThrownBy(() -> AdminController.parseStatus(" "))
                .isInstanceOf(InvalidSubmissionException.class);
    }
}
