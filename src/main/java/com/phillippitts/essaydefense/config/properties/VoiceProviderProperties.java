package com.phillippitts.essaydefense.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the conversational voice provider.
 */
@Validated
@ConfigurationProperties(prefix = "voice.provider")
public class VoiceProviderProperties {

    @NotBlank
    private final String baseUrl;

    private final String apiKey;

    /** Agent whose conversations are listed when looking a session up by its correlation token. */
    private final String agentId;

    /** How many recent conversations to scan when looking a session up by its token. */
    @Positive
    private final int pageSize;

    @ConstructorBinding
    public VoiceProviderProperties(String baseUrl, String apiKey, String agentId, Integer pageSize) {
        this.baseUrl = baseUrl == null ? "https://api.elevenlabs.io" : baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey;
        this.agentId = agentId == null ? "" : agentId;
        this.pageSize = pageSize == null ? 30 : pageSize;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getAgentId() {
        return agentId;
    }

    public int getPageSize() {
        return pageSize;
    }
}
