package com.phillippitts.essaydefense.service.grading;

import java.util.List;
import java.util.Objects;

/**
 * Structured result of parsing a grading response.
 *
 * @param multiplier    grade multiplier in [0.90, 1.05], two decimals
 * @param integrityFlag whether the defense suggests the student may not have written or understood the essay
 * @param comments      grader text, prefixed with {@link GradingResponseParser#INTEGRITY_MARKER} when flagged
 * @param method        how the multiplier was derived
 * @param elementScores rubric element scores found in the text, in order (may be fewer than four)
 */
public record GradingResult(
        double multiplier,
        boolean integrityFlag,
        String comments,
        ParseMethod method,
        List<Double> elementScores
) {

    public enum ParseMethod {
        /** An explicit final/grade/multiplier/average line. */
        EXPLICIT,
        /** Mean of four rubric element scores. */
        ELEMENT_MEAN,
        /** Nothing usable found; neutral multiplier. */
        DEFAULT
    }

    public GradingResult {
        if (multiplier < GradingResponseParser.MIN_MULTIPLIER || multiplier > GradingResponseParser.MAX_MULTIPLIER) {
            throw new IllegalArgumentException("Multiplier out of range: " + multiplier);
        }
        Objects.requireNonNull(method, "method");
        comments = comments == null ? "" : comments;
        elementScores = elementScores == null ? List.of() : List.copyOf(elementScores);
    }

    public boolean isParseFailure() {
        return method == ParseMethod.DEFAULT;
    }
}
