package com.phillippitts.essaydefense.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Questions frozen onto a submission at creation time. Order is the selection order.
 *
 * @param content content questions, in the order they were drawn
 * @param process process questions, in the order they were drawn
 */
public record SelectedQuestions(List<Question> content, List<Question> process) {

    public SelectedQuestions {
        content = content == null ? List.of() : List.copyOf(content);
        process = process == null ? List.of() : List.copyOf(process);
    }

    /**
     * Content questions first, then process questions.
     */
    public List<Question> ordered() {
        List<Question> all = new ArrayList<>(content.size() + process.size());
        all.addAll(content);
        all.addAll(process);
        return List.copyOf(all);
    }

    public int size() {
        return content.size() + process.size();
    }
}
