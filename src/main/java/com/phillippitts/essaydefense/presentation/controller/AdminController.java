package com.phillippitts.essaydefense.presentation.controller;

import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.exception.InvalidSubmissionException;
import com.phillippitts.essaydefense.service.grading.BatchGradingSummary;
import com.phillippitts.essaydefense.service.grading.GradingService;
import com.phillippitts.essaydefense.service.recovery.RecoveryScanner;
import com.phillippitts.essaydefense.service.recovery.RecoverySummary;
import com.phillippitts.essaydefense.service.review.ReviewService;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * Operator endpoints: on-demand recovery and grading, status toggle and review.
 */
@RestController
@RequestMapping("/api/admin")
class AdminController {

    private final RecoveryScanner recovery;
    private final GradingService grading;
    private final ReviewService review;

    AdminController(RecoveryScanner recovery, GradingService grading, ReviewService review) {
        this.recovery = recovery;
        this.grading = grading;
        this.review = review;
    }

    @PostMapping("/recovery")
    RecoverySummary recover() {
        return recovery.sweep();
    }

    @PostMapping("/grading")
    BatchGradingSummary gradeAll() {
        return grading.gradeAllEligible();
    }

    @PostMapping("/submissions/{sessionId}/grade")
    SubmissionView grade(@PathVariable String sessionId) {
        return SubmissionView.of(grading.grade(sessionId));
    }

    @PutMapping("/submissions/{sessionId}/status")
    SubmissionView setStatus(@PathVariable String sessionId, @RequestBody StatusRequest request) {
        return SubmissionView.of(review.overrideStatus(sessionId, parseStatus(request == null ? null : request.status())));
    }

    @PutMapping("/submissions/{sessionId}/review")
    SubmissionView markReviewed(@PathVariable String sessionId, @RequestBody(required = false) ReviewRequest request) {
        ReviewRequest r = request == null ? new ReviewRequest(null, null) : request;
        return SubmissionView.of(review.markReviewed(sessionId, r.instructorNotes(), r.finalGrade()));
    }

    static SubmissionStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidSubmissionException("status", "must not be blank");
        }
        for (SubmissionStatus s : SubmissionStatus.values()) {
            if (s.displayName().equalsIgnoreCase(raw.trim())) {
                return s;
            }
        }
        String normalized = raw.trim().replaceAll("[\\s-]+", "_").toUpperCase(Locale.ROOT);
        if ("DEFENSECOMPLETE".equals(normalized)) {
            normalized = "DEFENSE_COMPLETE";
        }
        try {
            return SubmissionStatus.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidSubmissionException("status", "unknown status '" + raw + "'");
        }
    }

    record StatusRequest(String status) {}

    record ReviewRequest(String instructorNotes, Double finalGrade) {}
}
