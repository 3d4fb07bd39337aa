package com.phillippitts.essaydefense.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Shared secret the voice provider presents on transcript webhook calls.
 *
 * <p>A blank secret is allowed at startup but rejects every webhook call.
 */
@Validated
@ConfigurationProperties(prefix = "defense.webhook")
public class WebhookProperties {

    private final String secret;

    @ConstructorBinding
    public WebhookProperties(String secret) {
        this.secret = secret == null ? "" : secret;
    }

    public String getSecret() {
        return secret;
    }

    public boolean isConfigured() {
        return !secret.isBlank();
    }
}
