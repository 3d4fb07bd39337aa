package com.phillippitts.essaydefense.presentation.controller;

import com.phillippitts.essaydefense.domain.Question;
import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.service.correlation.CorrelationEngine;
import com.phillippitts.essaydefense.service.intake.SubmissionReceipt;
import com.phillippitts.essaydefense.service.intake.SubmissionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Student-facing endpoints: essay intake, lookup and the defense-start report.
 */
@RestController
@RequestMapping("/api/submissions")
class SubmissionController {

    private final SubmissionService submissions;
    private final CorrelationEngine correlation;

    SubmissionController(SubmissionService submissions, CorrelationEngine correlation) {
        this.submissions = submissions;
        this.correlation = correlation;
    }

    @PostMapping
    ResponseEntity<IntakeResponse> submit(@RequestBody IntakeRequest request) {
        SubmissionReceipt receipt = submissions.submit(request.studentName(), request.essayText());
        Submission s = receipt.submission();
        return ResponseEntity.status(HttpStatus.CREATED).body(new IntakeResponse(s.sessionId(),
                s.selectedQuestions().ordered(), s.composedPrompt(), s.firstMessage(), receipt.warnings()));
    }

    @GetMapping("/{sessionId}")
    SubmissionView get(@PathVariable String sessionId) {
        return SubmissionView.of(submissions.get(sessionId));
    }

    @PostMapping("/{sessionId}/defense-started")
    SubmissionView defenseStarted(@PathVariable String sessionId,
                                  @RequestBody(required = false) DefenseStartRequest request) {
        String conversationId = request == null ? null : request.conversationId();
        return SubmissionView.of(correlation.markDefenseStarted(sessionId, conversationId));
    }

    record IntakeRequest(String studentName, String essayText) {}

    record IntakeResponse(String sessionId, List<Question> selectedQuestions, String composedPrompt,
                          String firstMessage, List<String> warnings) {}

    record DefenseStartRequest(String conversationId) {}
}
