package com.phillippitts.essaydefense.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a submission.
 *
 * <pre>
 * SUBMITTED → DEFENSE_STARTED → DEFENSE_COMPLETE → {EXCLUDED | GRADED} → REVIEWED
 *                                DEFENSE_COMPLETE ⇄ EXCLUDED (manual only)
 * </pre>
 *
 * <p>Status only moves forward. The single exception is the operator toggle between
 * {@link #EXCLUDED} and {@link #DEFENSE_COMPLETE}.
 */
public enum SubmissionStatus {
    SUBMITTED("Submitted", 0),
    DEFENSE_STARTED("Defense Started", 1),
    DEFENSE_COMPLETE("Defense Complete", 2),
    EXCLUDED("Excluded", 2),
    GRADED("Graded", 3),
    REVIEWED("Reviewed", 4);

    /** States in which a submission is still waiting for its transcript. */
    public static final Set<SubmissionStatus> AWAITING_TRANSCRIPT =
            Set.copyOf(EnumSet.of(SUBMITTED, DEFENSE_STARTED));

    private final String displayName;
    private final int rank;

    SubmissionStatus(String displayName, int rank) {
        this.displayName = displayName;
        this.rank = rank;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * True once a transcript has been attached; later deliveries must not be reapplied.
     */
    public boolean hasTranscript() {
        return rank >= 2;
    }

    public boolean isAwaitingTranscript() {
        return AWAITING_TRANSCRIPT.contains(this);
    }

    /**
     * Returns whether the system itself may move a submission from this status to {@code next}.
     *
     * <p>Excluded submissions never reach {@link #GRADED} automatically, and nothing leaves
     * {@link #REVIEWED}.
     */
    public boolean canAdvanceTo(SubmissionStatus next) {
        if (next == null || next == this) {
            return false;
        }
        if (this == EXCLUDED && next == GRADED) {
            return false;
        }
        if (this == DEFENSE_COMPLETE && next == EXCLUDED) {
            return false;
        }
        return next.rank > rank;
    }

    /**
     * Returns whether an operator may set {@code next} by hand: the exclusion toggle, or
     * marking a graded submission as reviewed.
     */
    public boolean canOverrideTo(SubmissionStatus next) {
        return (this == EXCLUDED && next == DEFENSE_COMPLETE)
                || (this == DEFENSE_COMPLETE && next == EXCLUDED)
                || (this == GRADED && next == REVIEWED);
    }
}
