package com.phillippitts.essaydefense.service.prompt;

import java.util.List;

/**
 * Output of {@link PromptComposer}.
 *
 * @param prompt       examiner system prompt
 * @param firstMessage examiner opening utterance
 * @param warnings     non-fatal problems, e.g. a named template that fell back to the built-in one
 */
public record ComposedPrompt(String prompt, String firstMessage, List<String> warnings) {

    public ComposedPrompt {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
