package com.phillippitts.essaydefense.service.correlation;

import com.phillippitts.essaydefense.domain.Speaker;
import com.phillippitts.essaydefense.domain.TranscriptTurn;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls self-introduced names out of the student's side of a transcript.
 *
 * <p>Recognized phrases (case-insensitive): "my name is X", "my name's X", "I'm X", "I am X",
 * "this is X". X is one or two capitalized tokens; capitalization is required so that
 * "I'm going to..." yields nothing.
 */
public final class NameExtractor {

    private static final Pattern INTRODUCTION = Pattern.compile(
            "(?i:\\b(?:my name is|my name's|i['\u2019]m|i am|this is))\\s+"
                    + "([A-Z][A-Za-z'\u2019-]+(?:\\s+[A-Z][A-Za-z'\u2019-]+)?)");

    // Capitalized words that follow "I'm"/"I am" without being names.
    private static final Set<String> NOT_NAMES = Set.of(
            "Sorry", "Not", "Ready", "Here", "Good", "Fine", "Sure", "Okay", "Ok", "Just", "So",
            "Well", "Happy", "Glad", "Excited", "Nervous", "Going", "The", "A", "An", "It", "That");

    private NameExtractor() {}

    /**
     * @param turns full transcript; examiner turns are ignored
     * @return distinct names in the order they were spoken
     */
    public static List<String> extractStudentNames(List<TranscriptTurn> turns) {
        Set<String> names = new LinkedHashSet<>();
        if (turns == null) {
            return List.of();
        }
        for (TranscriptTurn turn : turns) {
            if (turn.speaker() != Speaker.STUDENT) {
                continue;
            }
            names.addAll(extract(turn.message()));
        }
        return List.copyOf(names);
    }

    /**
     * Names introduced in a single utterance.
     */
    public static List<String> extract(String text) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        Matcher m = INTRODUCTION.matcher(text);
        while (m.find()) {
            String[] tokens = m.group(1).trim().split("\\s+");
            if (NOT_NAMES.contains(tokens[0])) {
                continue;
            }
            if (tokens.length > 1 && NOT_NAMES.contains(tokens[1])) {
                found.add(tokens[0]);
            } else {
                found.add(String.join(" ", tokens));
            }
        }
        return found;
    }
}
