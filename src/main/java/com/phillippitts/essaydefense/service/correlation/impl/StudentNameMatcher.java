package com.phillippitts.essaydefense.service.correlation.impl;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.service.correlation.MatchMethod;
import com.phillippitts.essaydefense.service.correlation.NameExtractor;
import com.phillippitts.essaydefense.service.correlation.TranscriptEvent;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Matches the name a student introduced themselves with against open submissions.
 *
 * <p>Two passes over the extracted names, in the order they were spoken:
 * <ol>
 *   <li>full name equals {@code studentName} (case-insensitive, whitespace-normalized)</li>
 *   <li>first names agree, when either the spoken name or {@code studentName} is a first name
 *       alone ("Jane" against "Jane Doe", or "Jane Doe" against "Jane")</li>
 * </ol>
 * Within a pass the newest submission wins.
 */
public final class StudentNameMatcher extends AbstractOpenSubmissionMatcher {

    @Override
    protected Optional<Submission> doMatch(TranscriptEvent event, List<Submission> openNewestFirst) {
        List<String> names = NameExtractor.extractStudentNames(event.turns());
        if (names.isEmpty()) {
            return Optional.empty();
        }
        for (String name : names) {
            String wanted = normalize(name);
            for (Submission s : openNewestFirst) {
                if (normalize(s.studentName()).equals(wanted)) {
                    return Optional.of(s);
                }
            }
        }
        for (String name : names) {
            String spoken = normalize(name);
            String wanted = firstToken(spoken);
            for (Submission s : openNewestFirst) {
                String stored = normalize(s.studentName());
                boolean firstNameOnly = spoken.equals(wanted) || stored.indexOf(' ') < 0;
                if (firstNameOnly && firstToken(stored).equals(wanted)) {
                    return Optional.of(s);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.STUDENT_NAME;
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String firstToken(String s) {
        int space = s.indexOf(' ');
        return space < 0 ? s : s.substring(0, space);
    }
}
