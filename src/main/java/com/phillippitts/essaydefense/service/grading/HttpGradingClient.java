package com.phillippitts.essaydefense.service.grading;

import com.phillippitts.essaydefense.config.properties.GradingProperties;
import com.phillippitts.essaydefense.service.external.NonRetryableCallException;
import com.phillippitts.essaydefense.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * Messages API client for the grading AI.
 *
 * <p>Request: {@code POST /v1/messages} with {@code {model, max_tokens, messages:[{role:"user",
 * content}]}}. The answer is the concatenated {@code text} of the returned content blocks.
 *
 * <p>Client errors other than 408 and 429 are wrapped in {@link NonRetryableCallException}.
 */
@Component
public class HttpGradingClient implements GradingClient {

    private static final Logger LOG = LogManager.getLogger(HttpGradingClient.class);

    static final String MESSAGES_PATH = "/v1/messages";

    private final RestTemplate restTemplate;
    private final GradingProperties properties;

    public HttpGradingClient(@Qualifier("gradingRestTemplate") RestTemplate restTemplate,
                             GradingProperties properties) {
        this.restTemplate = Objects.requireNonNull(restTemplate);
        this.properties = Objects.requireNonNull(properties);
    }

    @Override
    public String complete(String prompt) {
        JSONObject body = new JSONObject()
                .put("model", properties.getModel())
                .put("max_tokens", properties.getMaxTokens())
                .put("messages", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("content", prompt)));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        String response;
        try {
            response = restTemplate.postForObject(MESSAGES_PATH, new HttpEntity<>(body.toString(), headers),
                    String.class);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                    || e.getStatusCode().value() == HttpStatus.REQUEST_TIMEOUT.value()) {
                throw e;
            }
            throw new NonRetryableCallException("Grading AI rejected request: " + e.getStatusCode(), e);
        }
        return extractText(response);
    }

    /**
     * Pulls the answer text out of a Messages API response.
     *
     * @throws IllegalStateException if the response has no text content
     */
    static String extractText(String response) {
        if (response == null || response.isBlank()) {
            throw new IllegalStateException("Empty grading response");
        }
        try {
            JSONObject obj = new JSONObject(response);
            JSONArray content = obj.optJSONArray("content");
            if (content == null || content.isEmpty()) {
                throw new IllegalStateException("Grading response has no content blocks");
            }
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < content.length(); i++) {
                JSONObject block = content.optJSONObject(i);
                if (block != null && "text".equals(block.optString("type", "text"))) {
                    sb.append(block.optString("text", ""));
                }
            }
            if (sb.length() == 0) {
                throw new IllegalStateException("Grading response has no text content");
            }
            return sb.toString();
        } catch (JSONException e) {
            LOG.warn("Malformed grading response: '{}'", LogSanitizer.preview(response, 200));
            throw new IllegalStateException("Malformed grading response", e);
        }
    }
}
