package com.phillippitts.essaydefense.config;

import com.phillippitts.essaydefense.config.properties.ExternalCallProperties;
import com.phillippitts.essaydefense.config.properties.GradingProperties;
import com.phillippitts.essaydefense.config.properties.VoiceProviderProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * HTTP clients for the voice provider and the grading AI, plus the clock every time window uses.
 *
 * <p>Socket timeouts match the per-attempt budgets in {@link ExternalCallProperties}, so a stalled
 * connection is closed at roughly the moment the caller gives up on it.
 */
@Configuration
public class HttpClientConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public RestTemplate voiceProviderRestTemplate(RestTemplateBuilder builder,
                                                  VoiceProviderProperties voice,
                                                  ExternalCallProperties calls) {
        return builder
                .rootUri(voice.getBaseUrl())
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(Duration.ofMillis(calls.getVoiceTimeoutMs()))
                .defaultHeader("xi-api-key", voice.getApiKey())
                .build();
    }

    @Bean
    public RestTemplate gradingRestTemplate(RestTemplateBuilder builder,
                                            GradingProperties grading,
                                            ExternalCallProperties calls) {
        return builder
                .rootUri(grading.getBaseUrl())
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(Duration.ofMillis(calls.getGradingTimeoutMs()))
                .defaultHeader("x-api-key", grading.getApiKey())
                .defaultHeader("anthropic-version", "2023-06-01")
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
