package com.phillippitts.essaydefense.service.intake;

import com.phillippitts.essaydefense.domain.Submission;

import java.util.List;

/**
 * The stored submission plus any non-fatal problems met while composing its prompt.
 */
public record SubmissionReceipt(Submission submission, List<String> warnings) {

    public SubmissionReceipt {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
