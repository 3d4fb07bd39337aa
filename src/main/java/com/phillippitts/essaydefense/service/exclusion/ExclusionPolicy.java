package com.phillippitts.essaydefense.service.exclusion;

import com.phillippitts.essaydefense.config.properties.DefenseProperties;
import com.phillippitts.essaydefense.domain.SubmissionStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides the status a submission takes once its transcript is attached.
 *
 * <p>A call shorter than {@code defense.min-call-length-seconds} is {@link SubmissionStatus#EXCLUDED}
 * (too short to grade, which is not a failing grade). An unknown duration is not excluded.
 *
 * <p>Only consulted at attach time. Once a submission holds a transcript, its
 * {@code EXCLUDED}/{@code DEFENSE_COMPLETE} status belongs to the operator.
 */
@Component
public class ExclusionPolicy {

    private final int minCallLengthSeconds;

    @Autowired
    public ExclusionPolicy(DefenseProperties properties) {
        this(properties.getMinCallLengthSeconds());
    }

    public ExclusionPolicy(int minCallLengthSeconds) {
        if (minCallLengthSeconds < 0) {
            throw new IllegalArgumentException("minCallLengthSeconds must be >= 0");
        }
        this.minCallLengthSeconds = minCallLengthSeconds;
    }

    public boolean isExcluded(Integer callDurationSeconds) {
        return callDurationSeconds != null && callDurationSeconds < minCallLengthSeconds;
    }

    public SubmissionStatus statusAfterDefense(Integer callDurationSeconds) {
        return isExcluded(callDurationSeconds) ? SubmissionStatus.EXCLUDED : SubmissionStatus.DEFENSE_COMPLETE;
    }

    public int getMinCallLengthSeconds() {
        return minCallLengthSeconds;
    }
}
