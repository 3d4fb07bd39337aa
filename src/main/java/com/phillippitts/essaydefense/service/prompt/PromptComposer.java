package com.phillippitts.essaydefense.service.prompt;

import com.phillippitts.essaydefense.domain.Question;
import com.phillippitts.essaydefense.domain.SelectedQuestions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders the examiner prompt and opening utterance for a submission.
 *
 * <p>Output layout, in order:
 * <ol>
 *   <li>persona instructions</li>
 *   <li>examination-flow instructions</li>
 *   <li>the essay, verbatim</li>
 *   <li>numbered questions, content first then process, in selection order</li>
 * </ol>
 *
 * <p>Output depends only on the arguments and the template texts, so the same inputs always give
 * byte-identical prompts. A missing template is replaced by {@link TemplateKind#builtInDefault()}
 * and reported in {@link ComposedPrompt#warnings()}; composition itself never fails.
 */
@Component
public class PromptComposer {

    private static final Logger LOG = LogManager.getLogger(PromptComposer.class);

    public static final String NAME_PLACEHOLDER = "{{student_name}}";

    private final TemplateSource templates;

    public PromptComposer(TemplateSource templates) {
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    public ComposedPrompt compose(String studentName,
                                  String essayText,
                                  SelectedQuestions questions,
                                  String personalityTemplate,
                                  String flowTemplate,
                                  String firstMessageTemplate) {
        List<String> warnings = new ArrayList<>();
        String personality = resolve(TemplateKind.PERSONALITY, personalityTemplate, warnings);
        String flow = resolve(TemplateKind.FLOW, flowTemplate, warnings);
        String opening = resolve(TemplateKind.FIRST_MESSAGE, firstMessageTemplate, warnings);

        String name = studentName == null ? "" : studentName.trim();
        StringBuilder sb = new StringBuilder();
        sb.append(personality).append("\n\n");
        sb.append(flow).append("\n\n");
        sb.append("STUDENT NAME: ").append(name).append("\n\n");
        sb.append("STUDENT ESSAY:\n\"\"\"\n").append(essayText == null ? "" : essayText).append("\n\"\"\"\n\n");
        sb.append("QUESTIONS TO ASK:\n");
        int n = 1;
        for (Question q : questions.ordered()) {
            sb.append(n++).append(". ").append(q.text()).append('\n');
        }

        return new ComposedPrompt(sb.toString(), opening.replace(NAME_PLACEHOLDER, name), warnings);
    }

    private String resolve(TemplateKind kind, String name, List<String> warnings) {
        return templates.find(kind, name).orElseGet(() -> {
            String warning = "Template " + kind.directory() + "/" + name + " not found, using built-in default";
            LOG.warn(warning);
            warnings.add(warning);
            return kind.builtInDefault();
        });
    }
}
