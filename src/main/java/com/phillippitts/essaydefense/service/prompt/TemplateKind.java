package com.phillippitts.essaydefense.service.prompt;

/**
 * Kinds of externally supplied template, each with the built-in text used when the named
 * template cannot be found.
 */
public enum TemplateKind {
    PERSONALITY("personality",
            "You are a calm, fair academic examiner conducting a short oral defense of a student's essay. "
                    + "Speak in plain language, ask one question at a time and let the student finish."),
    FLOW("flow",
            "Greet the student, then work through the numbered questions in order. "
                    + "Ask at most one follow-up per question when an answer is vague. "
                    + "Do not reveal grades or judge answers aloud. "
                    + "When all questions are covered, thank the student and end the conversation."),
    FIRST_MESSAGE("first-message",
            "Hello {{student_name}}, thanks for joining. I'd like to ask you a few questions about your essay. "
                    + "Could you start by telling me your name?");

    private final String directory;
    private final String builtInDefault;

    TemplateKind(String directory, String builtInDefault) {
        this.directory = directory;
        this.builtInDefault = builtInDefault;
    }

    public String directory() {
        return directory;
    }

    public String builtInDefault() {
        return builtInDefault;
    }
}
