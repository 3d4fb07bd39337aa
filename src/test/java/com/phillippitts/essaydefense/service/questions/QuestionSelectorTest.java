package com.phillippitts.essaydefense.service.questions;

import com.phillippitts.essaydefense.domain.Question;
import com.phillippitts.essaydefense.domain.QuestionCategory;
import com.phillippitts.essaydefense.domain.SelectedQuestions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class QuestionSelectorTest {

    private static QuestionBank bank(int content, int process) {
        List<Question> qs = new ArrayList<>();
        for (int i = 1; i <= content; i++) {
            qs.add(new Question("c" + i, QuestionCategory.CONTENT, "content " + i));
        }
        for (int i = 1; i <= process; i++) {
            qs.add(new Question("p" + i, QuestionCategory.PROCESS, "process " + i));
        }
        return new QuestionBank(qs);
    }

    @Test
    void selectsRequestedCountsWithoutDuplicates() {
        QuestionSelector selector = new QuestionSelector(bank(8, 5), new Random(42));

        SelectedQuestions selected = selector.select(3, 2);

        assertThat(selected.content()).hasSize(3).doesNotHaveDuplicates()
                .allMatch(q -> q.category() == QuestionCategory.CONTENT);
        assertThat(selected.process()).hasSize(2).doesNotHaveDuplicates()
                .allMatch(q -> q.category() == QuestionCategory.PROCESS);
        assertThat(selected.ordered()).startsWith(selected.content().toArray(new Question[0]));
    }

    @Test
    void smallPoolReturnsWholePool() {
        QuestionSelector selector = new QuestionSelector(bank(2, 0), new Random(1));

        SelectedQuestions selected = selector.select(5, 3);

        assertThat(selected.content()).extracting(Question::id).containsExactlyInAnyOrder("c1", "c2");
        assertThat(selected.process()).isEmpty();
    }

    @Test
    void zeroOrNegativeCountsSelectNothing() {
        QuestionSelector selector = new QuestionSelector(bank(4, 4), new Random(1));

        assertThat(selector.select(0, -1).size()).isZero();
    }

    @Test
    void everyPermutationIsAboutEquallyLikely() {
        QuestionSelector selector = new QuestionSelector(bank(3, 0), new Random(7));
        Map<String, Integer> counts = new HashMap<>();
        int draws = 60_000;

        for (int i = 0; i < draws; i++) {
            String key = selector.select(3, 0).content().stream().map(Question::id)
                    .reduce("", String::concat);
            counts.merge(key, 1, Integer::sum);
        }

        assertThat(counts).hasSize(6);
        double expected = draws / 6.0;
        assertThat(counts.values()).allSatisfy(c ->
                assertThat(Math.abs(c - expected) / expected).isLessThan(0.05));
    }
}
