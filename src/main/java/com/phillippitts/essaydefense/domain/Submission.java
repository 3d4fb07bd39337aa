package com.phillippitts.essaydefense.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one essay submission and everything attached to it afterwards.
 *
 * <p>Updates produce new snapshots via {@link #toBuilder()}; the store swaps snapshots atomically
 * per {@code sessionId}.
 *
 * @param sessionId           opaque unique id minted at creation, the primary correlation key
 * @param studentName         free text, only a fallback correlation signal
 * @param essayText           essay body, immutable once submitted
 * @param selectedQuestions   questions frozen at creation
 * @param composedPrompt      examiner prompt rendered at creation
 * @param firstMessage        examiner opening utterance rendered at creation
 * @param status              lifecycle status
 * @param transcript          two-speaker transcript, null until attached
 * @param conversationId      voice provider conversation reference, null until known
 * @param callDurationSeconds call length reported by the provider, null if unknown
 * @param grade               multiplier in [0.90, 1.05], only set once graded
 * @param gradeComments       grader comments, only set once graded
 * @param integrityFlag       grader integrity signal, only meaningful once graded
 * @param instructorNotes     operator notes added on review
 * @param finalGrade          operator final grade added on review
 * @param createdAt           creation time
 * @param defenseStartedAt    when the voice session began (backfilled if never reported)
 * @param defenseEndedAt      when the transcript was attached
 * @param gradedAt            when the grade was stored
 */
public record Submission(
        String sessionId,
        String studentName,
        String essayText,
        SelectedQuestions selectedQuestions,
        String composedPrompt,
        String firstMessage,
        SubmissionStatus status,
        String transcript,
        String conversationId,
        Integer callDurationSeconds,
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

    public Submission {
        Objects.requireNonNull(sessionId, "Session id must not be null");
        Objects.requireNonNull(studentName, "Student name must not be null");
        Objects.requireNonNull(essayText, "Essay text must not be null");
        Objects.requireNonNull(selectedQuestions, "Selected questions must not be null");
        Objects.requireNonNull(status, "Status must not be null");
        Objects.requireNonNull(createdAt, "Created-at must not be null");
    }

    /**
     * Creates a freshly submitted record.
     */
    public static Submission create(String sessionId,
                                    String studentName,
                                    String essayText,
                                    SelectedQuestions questions,
                                    String composedPrompt,
                                    String firstMessage,
                                    Instant createdAt) {
        return new Builder()
                .sessionId(sessionId)
                .studentName(studentName)
                .essayText(essayText)
                .selectedQuestions(questions)
                .composedPrompt(composedPrompt)
                .firstMessage(firstMessage)
                .status(SubmissionStatus.SUBMITTED)
                .createdAt(createdAt)
                .build();
    }

    public boolean hasTranscript() {
        return transcript != null && !transcript.isBlank();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Mutable builder used to derive the next snapshot.
     */
    public static final class Builder {
        private String sessionId;
        private String studentName;
        private String essayText;
        private SelectedQuestions selectedQuestions;
        private String composedPrompt;
        private String firstMessage;
        private SubmissionStatus status;
        private String transcript;
        private String conversationId;
        private Integer callDurationSeconds;
        private Double grade;
        private String gradeComments;
        private boolean integrityFlag;
        private String instructorNotes;
        private Double finalGrade;
        private Instant createdAt;
        private Instant defenseStartedAt;
        private Instant defenseEndedAt;
        private Instant gradedAt;

        public Builder() {
        }

        private Builder(Submission s) {
            this.sessionId = s.sessionId;
            this.studentName = s.studentName;
            this.essayText = s.essayText;
            this.selectedQuestions = s.selectedQuestions;
            this.composedPrompt = s.composedPrompt;
            this.firstMessage = s.firstMessage;
            this.status = s.status;
            this.transcript = s.transcript;
            this.conversationId = s.conversationId;
            this.callDurationSeconds = s.callDurationSeconds;
            this.grade = s.grade;
            this.gradeComments = s.gradeComments;
            this.integrityFlag = s.integrityFlag;
            this.instructorNotes = s.instructorNotes;
            this.finalGrade = s.finalGrade;
            this.createdAt = s.createdAt;
            this.defenseStartedAt = s.defenseStartedAt;
            this.defenseEndedAt = s.defenseEndedAt;
            this.gradedAt = s.gradedAt;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder studentName(String studentName) {
            this.studentName = studentName;
            return this;
        }

        public Builder essayText(String essayText) {
            this.essayText = essayText;
            return this;
        }

        public Builder selectedQuestions(SelectedQuestions selectedQuestions) {
            this.selectedQuestions = selectedQuestions;
            return this;
        }

        public Builder composedPrompt(String composedPrompt) {
            this.composedPrompt = composedPrompt;
            return this;
        }

        public Builder firstMessage(String firstMessage) {
            this.firstMessage = firstMessage;
            return this;
        }

        public Builder status(SubmissionStatus status) {
            this.status = status;
            return this;
        }

        public Builder transcript(String transcript) {
            this.transcript = transcript;
            return this;
        }

        public Builder conversationId(String conversationId) {
            this.conversationId = conversationId;
            return this;
        }

        public Builder callDurationSeconds(Integer callDurationSeconds) {
            this.callDurationSeconds = callDurationSeconds;
            return this;
        }

        public Builder grade(Double grade) {
            this.grade = grade;
            return this;
        }

        public Builder gradeComments(String gradeComments) {
            this.gradeComments = gradeComments;
            return this;
        }

        public Builder integrityFlag(boolean integrityFlag) {
            this.integrityFlag = integrityFlag;
            return this;
        }

        public Builder instructorNotes(String instructorNotes) {
            this.instructorNotes = instructorNotes;
            return this;
        }

        public Builder finalGrade(Double finalGrade) {
            this.finalGrade = finalGrade;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder defenseStartedAt(Instant defenseStartedAt) {
            this.defenseStartedAt = defenseStartedAt;
            return this;
        }

        public Builder defenseEndedAt(Instant defenseEndedAt) {
            this.defenseEndedAt = defenseEndedAt;
            return this;
        }

        public Builder gradedAt(Instant gradedAt) {
            this.gradedAt = gradedAt;
            return this;
        }

        public Submission build() {
            return new Submission(sessionId, studentName, essayText, selectedQuestions, composedPrompt,
                    firstMessage, status, transcript, conversationId, callDurationSeconds, grade,
                    gradeComments, integrityFlag, instructorNotes, finalGrade, createdAt,
                    defenseStartedAt, defenseEndedAt, gradedAt);
        }
    }
}
