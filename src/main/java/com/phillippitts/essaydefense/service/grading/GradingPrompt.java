package com.phillippitts.essaydefense.service.grading;

import com.phillippitts.essaydefense.domain.Submission;

/**
 * Builds the text sent to the grading AI.
 */
final class GradingPrompt {

    private GradingPrompt() {
    }

    static String build(String rubric, Submission submission) {
        return rubric
                + "\n\nSTUDENT NAME: " + submission.studentName()
                + "\n\nSTUDENT ESSAY:\n\"\"\"\n" + submission.essayText() + "\n\"\"\""
                + "\n\nDEFENSE TRANSCRIPT:\n\"\"\"\n" + submission.transcript() + "\n\"\"\""
                + "\n\nScore each rubric element on its own line as \"<element> score: N\", "
                + "then give the final multiplier as \"Final multiplier: N.NN\". "
                + "If you have integrity concerns, add the line \"Integrity flag: yes\".";
    }
}
