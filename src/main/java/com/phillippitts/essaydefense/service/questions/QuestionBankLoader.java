package com.phillippitts.essaydefense.service.questions;

import com.phillippitts.essaydefense.domain.Question;
import com.phillippitts.essaydefense.domain.QuestionCategory;
import com.phillippitts.essaydefense.exception.EssayDefenseException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses the question bank JSON:
 *
 * <pre>
 * {
 *   "content": [ {"id": "c1", "text": "..."}, ... ],
 *   "process": [ {"id": "p1", "text": "..."}, ... ]
 * }
 * </pre>
 *
 * Plain strings are accepted in place of objects; they get positional ids ({@code content-1}).
 * Unlike the webhook parser this one fails loudly: a broken bank is a deployment error.
 */
final class QuestionBankLoader {

    private QuestionBankLoader() {}

    static QuestionBank parse(String json) {
        if (json == null || json.isBlank()) {
            throw new EssayDefenseException("Question bank is empty");
        }
        try {
            JSONObject root = new JSONObject(json);
            List<Question> questions = new ArrayList<>();
            Set<String> ids = new HashSet<>();
            for (QuestionCategory category : QuestionCategory.values()) {
                String key = category.name().toLowerCase(Locale.ROOT);
                JSONArray items = root.optJSONArray(key);
                if (items == null) {
                    continue;
                }
                for (int i = 0; i < items.length(); i++) {
                    Question q = toQuestion(items.get(i), category, key + "-" + (i + 1));
                    if (!ids.add(q.id())) {
                        throw new EssayDefenseException("Duplicate question id in bank: " + q.id());
                    }
                    questions.add(q);
                }
            }
            return new QuestionBank(questions);
        } catch (JSONException | IllegalArgumentException e) {
            throw new EssayDefenseException("Malformed question bank: " + e.getMessage(), e);
        }
    }

    private static Question toQuestion(Object item, QuestionCategory category, String fallbackId) {
        if (item instanceof JSONObject obj) {
            String id = obj.optString("id", "");
            return new Question(id.isBlank() ? fallbackId : id, category, obj.optString("text", "").trim());
        }
        return new Question(fallbackId, category, String.valueOf(item).trim());
    }
}
