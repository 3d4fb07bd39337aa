package com.phillippitts.essaydefense.service.questions;

import com.phillippitts.essaydefense.domain.Question;
import com.phillippitts.essaydefense.domain.QuestionCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only question bank partitioned by category.
 */
public final class QuestionBank {

    private final Map<QuestionCategory, List<Question>> byCategory;

    public QuestionBank(List<Question> questions) {
        Map<QuestionCategory, List<Question>> grouped = new EnumMap<>(QuestionCategory.class);
        for (QuestionCategory c : QuestionCategory.values()) {
            grouped.put(c, new ArrayList<>());
        }
        for (Question q : questions) {
            grouped.get(q.category()).add(q);
        }
        grouped.replaceAll((c, list) -> List.copyOf(list));
        this.byCategory = Collections.unmodifiableMap(grouped);
    }

    /**
     * Questions of one category in bank order. The returned list is unmodifiable.
     */
    public List<Question> questions(QuestionCategory category) {
        return byCategory.get(category);
    }

    public int size() {
        return byCategory.values().stream().mapToInt(List::size).sum();
    }
}
