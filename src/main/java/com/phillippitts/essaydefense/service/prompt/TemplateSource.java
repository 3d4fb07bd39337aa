package com.phillippitts.essaydefense.service.prompt;

import java.util.Optional;

/**
 * Supplies named prompt templates. Implementations must return the same text for the same name
 * for the lifetime of the application.
 */
public interface TemplateSource {

    /**
     * @param kind template kind
     * @param name template name, e.g. "default" or "strict"
     * @return the template text, or empty if no such template exists
     */
    Optional<String> find(TemplateKind kind, String name);
}
