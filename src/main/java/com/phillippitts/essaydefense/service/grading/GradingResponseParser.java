package com.phillippitts.essaydefense.service.grading;

import com.phillippitts.essaydefense.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the grading AI's free text into a multiplier and an integrity flag.
 *
 * <p><b>Multiplier, first success wins:</b>
 * <ol>
 *   <li>explicit declaration, patterns tried in order: {@code final/grade/multiplier ...: N},
 *       {@code average ...: N}, {@code N final/average/overall}</li>
 *   <li>mean of the first four {@code score:}/{@code rating:} numbers, when at least four exist.
 *       Lines labelled final, overall, average, total, multiplier or grade are summaries, not
 *       rubric elements, and are skipped.</li>
 *   <li>neutral {@value #NEUTRAL_MULTIPLIER}, reported as {@link GradingResult.ParseMethod#DEFAULT}</li>
 * </ol>
 *
 * <p>Element means always go through {@link #multiplierFromMean(double)}:
 * {@code clamp(1.00 + (mean - 3) * 0.05, 0.90, 1.05)} rounded to two decimals, whatever the
 * grader's own arithmetic said. An explicit value above {@value #EXPLICIT_MEAN_THRESHOLD} is on the
 * 1-5 element scale and is converted the same way; smaller values are multipliers and are clamped.
 *
 * <p><b>Integrity flag:</b> any element score equal to 1, a four-element mean at or below 1.5, or an
 * explicit "integrity flag: yes" line.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class GradingResponseParser {

    private static final Logger LOG = LogManager.getLogger(GradingResponseParser.class);

    public static final double MIN_MULTIPLIER = 0.90;
    public static final double MAX_MULTIPLIER = 1.05;
    public static final double NEUTRAL_MULTIPLIER = 1.00;
    public static final String INTEGRITY_MARKER = "[INTEGRITY WARNING] ";

    static final double EXPLICIT_MEAN_THRESHOLD = 1.5;
    private static final double INTEGRITY_MEAN_THRESHOLD = 1.5;
    private static final int ELEMENT_COUNT = 4;

    private static final String NUMBER = "(\\d+(?:\\.\\d+)?)";

    private static final List<Pattern> EXPLICIT_PATTERNS = List.of(
            Pattern.compile("(?i)\\b(?:final|grade|multiplier)\\b[^:\\n]{0,40}:\\s*[*_~`\\s]*" + NUMBER),
            Pattern.compile("(?i)\\baverage\\b[^:\\n]{0,40}:\\s*[*_~`\\s]*" + NUMBER),
            Pattern.compile("(?i)" + NUMBER + "\\s*(?:\\(|\\s)*\\b(?:final|average|overall)\\b"));

    private static final Pattern ELEMENT_SCORE =
            Pattern.compile("(?i)\\b(?:score|rating)\\s*:\\s*[*_~`\\s]*" + NUMBER);

    private static final Pattern SUMMARY_LABEL =
            Pattern.compile("(?i)\\b(?:final|overall|average|total|multiplier|grade)\\b");

    private static final Pattern INTEGRITY_DECLARATION =
            Pattern.compile("(?i)\\bintegrity\\s*(?:flag|concern)\\s*:\\s*[*_~`\\s]*(yes|true)\\b");

    /**
     * Parses a grading response. Never throws; unusable text yields the neutral multiplier.
     *
     * @param text grader output, may be null
     * @return structured result
     */
    public GradingResult parse(String text) {
        String body = text == null ? "" : text.strip();
        List<Double> elements = elementScores(body);
        OptionalDouble fourMean = elements.size() >= ELEMENT_COUNT
                ? OptionalDouble.of(mean(elements.subList(0, ELEMENT_COUNT)))
                : OptionalDouble.empty();

        double multiplier;
        GradingResult.ParseMethod method;
        OptionalDouble explicit = explicitValue(body);
        if (explicit.isPresent()) {
            double v = explicit.getAsDouble();
            multiplier = v > EXPLICIT_MEAN_THRESHOLD ? multiplierFromMean(v) : clampAndRound(v);
            method = GradingResult.ParseMethod.EXPLICIT;
        } else if (fourMean.isPresent()) {
            multiplier = multiplierFromMean(fourMean.getAsDouble());
            method = GradingResult.ParseMethod.ELEMENT_MEAN;
        } else {
            multiplier = NEUTRAL_MULTIPLIER;
            method = GradingResult.ParseMethod.DEFAULT;
            LOG.warn("Grading response did not contain a usable score, defaulting to {}: '{}'",
                    NEUTRAL_MULTIPLIER, LogSanitizer.preview(body, 120));
        }

        boolean flag = elements.stream().anyMatch(e -> e == 1.0)
                || (fourMean.isPresent() && fourMean.getAsDouble() <= INTEGRITY_MEAN_THRESHOLD)
                || INTEGRITY_DECLARATION.matcher(body).find();

        String comments = flag ? INTEGRITY_MARKER + body : body;
        return new GradingResult(multiplier, flag, comments, method, elements);
    }

    /**
     * Canonical multiplier for a mean rubric element score.
     */
    public static double multiplierFromMean(double mean) {
        return clampAndRound(1.00 + (mean - 3.0) * 0.05);
    }

    static double clampAndRound(double value) {
        double clamped = Math.max(MIN_MULTIPLIER, Math.min(MAX_MULTIPLIER, value));
        return BigDecimal.valueOf(clamped).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static OptionalDouble explicitValue(String body) {
        for (Pattern p : EXPLICIT_PATTERNS) {
            Matcher m = p.matcher(body);
            if (m.find()) {
                try {
                    return OptionalDouble.of(Double.parseDouble(m.group(1)));
                } catch (NumberFormatException e) {
                    LOG.debug("Unparseable number '{}' for pattern {}", m.group(1), p.pattern());
                }
            }
        }
        return OptionalDouble.empty();
    }

    private static List<Double> elementScores(String body) {
        List<Double> scores = new ArrayList<>();
        for (String line : body.split("\\R")) {
            Matcher m = ELEMENT_SCORE.matcher(line);
            if (!m.find() || SUMMARY_LABEL.matcher(line.substring(0, m.start())).find()) {
                continue;
            }
            do {
                try {
                    scores.add(Double.parseDouble(m.group(1)));
                } catch (NumberFormatException e) {
                    LOG.debug("Unparseable element score '{}'", m.group(1));
                }
            } while (m.find());
        }
        return scores;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
