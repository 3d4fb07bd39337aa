package com.phillippitts.essaydefense.service.review;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.exception.IllegalStatusTransitionException;
import com.phillippitts.essaydefense.exception.InvalidSubmissionException;
import com.phillippitts.essaydefense.exception.SubmissionNotFoundException;
import com.phillippitts.essaydefense.store.SubmissionStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Operator actions: the Excluded/DefenseComplete toggle and the final review.
 */
@Service
public class ReviewService {

    private static final Logger LOG = LogManager.getLogger(ReviewService.class);

    private final SubmissionStore store;

    public ReviewService(SubmissionStore store) {
        this.store = Objects.requireNonNull(store);
    }

    /**
     * Moves a submission between EXCLUDED and DEFENSE_COMPLETE. Setting the current status again is
     * a no-op.
     *
     * @throws IllegalStatusTransitionException for any other change
     * @throws SubmissionNotFoundException      if no such submission
     */
    public Submission overrideStatus(String sessionId, SubmissionStatus target) {
        Objects.requireNonNull(target, "target");
        Submission after = store.update(sessionId, current -> {
            if (current.status() == target) {
                return current;
            }
            if (!current.status().canOverrideTo(target) || target == SubmissionStatus.REVIEWED) {
                throw new IllegalStatusTransitionException(sessionId, current.status(), target);
            }
            return current.toBuilder().status(target).build();
        });
        LOG.info("Operator set status of {} to {}", sessionId, after.status());
        return after;
    }

    /**
     * Marks a graded submission as reviewed, optionally with notes and a final grade.
     *
     * @throws IllegalStatusTransitionException if it is not GRADED
     * @throws InvalidSubmissionException       if the final grade is negative
     */
    public Submission markReviewed(String sessionId, String instructorNotes, Double finalGrade) {
        if (finalGrade != null && (finalGrade.isNaN() || finalGrade < 0)) {
            throw new InvalidSubmissionException("finalGrade", "must be a non-negative number");
        }
        Submission after = store.update(sessionId, current -> {
            if (current.status() != SubmissionStatus.GRADED) {
                throw new IllegalStatusTransitionException(sessionId, current.status(), SubmissionStatus.REVIEWED);
            }
            return current.toBuilder()
                    .status(SubmissionStatus.REVIEWED)
                    .instructorNotes(instructorNotes == null || instructorNotes.isBlank() ? null : instructorNotes)
                    .finalGrade(finalGrade)
                    .build();
        });
        LOG.info("Submission {} reviewed", sessionId);
        return after;
    }
}
