package com.phillippitts.essaydefense.domain;

import java.util.Objects;

/**
 * One examiner question from the bank.
 *
 * @param id       stable identifier within the bank
 * @param category content or process
 * @param text     question wording as read to the student
 */
public record Question(String id, QuestionCategory category, String text) {

    public Question {
        Objects.requireNonNull(id, "Question id must not be null");
        Objects.requireNonNull(category, "Question category must not be null");
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Question text must not be blank: " + id);
        }
    }
}
