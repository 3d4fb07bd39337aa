package com.phillippitts.essaydefense.service.questions;

import com.phillippitts.essaydefense.domain.Question;
import com.phillippitts.essaydefense.domain.QuestionCategory;
import com.phillippitts.essaydefense.domain.SelectedQuestions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Draws the questions a student will be asked.
 *
 * <p>Each category is shuffled on a private copy with Fisher–Yates (every permutation equally
 * likely) and the first {@code min(requested, available)} questions are taken. The bank is never
 * mutated. Called once per submission; the result is frozen onto the record.
 *
 * <p>Thread-safe as long as the supplied {@link Random} is ({@code java.util.Random} is).
 */
public class QuestionSelector {

    private final QuestionBank bank;
    private final Random random;

    public QuestionSelector(QuestionBank bank, Random random) {
        this.bank = Objects.requireNonNull(bank, "bank");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Selects questions for one submission.
     *
     * @param contentCount desired number of content questions (negative treated as 0)
     * @param processCount desired number of process questions (negative treated as 0)
     * @return frozen selection
     */
    public SelectedQuestions select(int contentCount, int processCount) {
        return new SelectedQuestions(
                draw(bank.questions(QuestionCategory.CONTENT), contentCount),
                draw(bank.questions(QuestionCategory.PROCESS), processCount));
    }

    private List<Question> draw(List<Question> pool, int requested) {
        int n = Math.min(Math.max(requested, 0), pool.size());
        if (n == 0) {
            return List.of();
        }
        List<Question> copy = new ArrayList<>(pool);
        for (int i = copy.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            Question tmp = copy.get(i);
            copy.set(i, copy.get(j));
            copy.set(j, tmp);
        }
        return List.copyOf(copy.subList(0, n));
    }
}
