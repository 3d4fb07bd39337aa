package com.phillippitts.essaydefense.service.grading;

import java.util.List;

/**
 * Result of grading every eligible submission.
 *
 * @param graded          session ids graded in this run
 * @param failed          session ids whose grading failed; they stay DEFENSE_COMPLETE
 * @param skippedExcluded number of EXCLUDED submissions left alone
 */
public record BatchGradingSummary(List<String> graded, List<String> failed, int skippedExcluded) {

    public BatchGradingSummary {
        graded = List.copyOf(graded);
        failed = List.copyOf(failed);
    }
}
