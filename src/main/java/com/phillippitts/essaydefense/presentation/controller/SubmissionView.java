package com.phillippitts.essaydefense.presentation.controller;

import com.phillippitts.essaydefense.domain.Question;
import com.phillippitts.essaydefense.domain.Submission;

import java.time.Instant;
import java.util.List;

/**
 * JSON view of a submission.
 */
record SubmissionView(
        String sessionId,
        String studentName,
        String status,
        List<Question> selectedQuestions,
        String composedPrompt,
        String firstMessage,
        String conversationId,
        Integer callDurationSeconds,
        String transcript,
        Double grade,
        String gradeComments,
        boolean integrityFlag,
        String instructorNotes,
        Double finalGrade,
        Instant createdAt,
        Instant defenseStartedAt,
        Instant defenseEndedAt,
        Instant gradedAt
) {

    static SubmissionView of(Submission s) {
        return new SubmissionView(s.sessionId(), s.studentName(), s.status().name(),
                s.selectedQuestions().ordered(), s.composedPrompt(), s.firstMessage(), s.conversationId(),
                s.callDurationSeconds(), s.transcript(), s.grade(), s.gradeComments(), s.integrityFlag(),
                s.instructorNotes(), s.finalGrade(), s.createdAt(), s.defenseStartedAt(), s.defenseEndedAt(),
                s.gradedAt());
    }
}
