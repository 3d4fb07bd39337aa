package com.phillippitts.essaydefense.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and prompt settings for the grading AI.
 */
@Validated
@ConfigurationProperties(prefix = "grading")
public class GradingProperties {

    @NotBlank
    private final String baseUrl;

    private final String apiKey;

    @NotBlank
    private final String model;

    @Positive
    private final int maxTokens;

    /** Classpath resource holding the rubric sent with every grading request. */
    @NotBlank
    private final String rubric;

    @ConstructorBinding
    public GradingProperties(String baseUrl, String apiKey, String model, Integer maxTokens, String rubric) {
        this.baseUrl = baseUrl == null ? "https://api.anthropic.com" : baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey;
        this.model = model == null ? "claude-3-5-sonnet-latest" : model;
        this.maxTokens = maxTokens == null ? 2000 : maxTokens;
        this.rubric = rubric == null ? "classpath:rubric.txt" : rubric;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getModel() {
        return model;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public String getRubric() {
        return rubric;
    }
}
