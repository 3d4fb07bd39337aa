package com.phillippitts.essaydefense.service.recovery;

import com.phillippitts.essaydefense.config.properties.VoiceProviderProperties;
import com.phillippitts.essaydefense.service.correlation.TranscriptEvent;
import com.phillippitts.essaydefense.service.correlation.TranscriptPayloadParser;
import com.phillippitts.essaydefense.service.external.NonRetryableCallException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conversational AI REST client.
 *
 * <ul>
 *   <li>{@code GET /v1/convai/conversations/{id}}: detail with {@code status}, {@code transcript},
 *       {@code metadata.call_duration_secs}</li>
 *   <li>{@code GET /v1/convai/conversations?agent_id=..&page_size=..}: ids of recent conversations,
 *       scanned for a correlation token when no conversation id was ever reported</li>
 * </ul>
 *
 * <p>404 maps to {@link FetchResult.Outcome#NOT_FOUND}; any status other than {@code done} maps to
 * {@link FetchResult.Outcome#IN_PROGRESS}. Other client errors are not retried.
 */
@Component
public class HttpVoiceProviderClient implements VoiceProviderClient {

    private static final Logger LOG = LogManager.getLogger(HttpVoiceProviderClient.class);

    static final String CONVERSATIONS_PATH = "/v1/convai/conversations";
    static final String STATUS_DONE = "done";

    private final RestTemplate restTemplate;
    private final VoiceProviderProperties properties;

    public HttpVoiceProviderClient(@Qualifier("voiceProviderRestTemplate") RestTemplate restTemplate,
                                   VoiceProviderProperties properties) {
        this.restTemplate = Objects.requireNonNull(restTemplate);
        this.properties = Objects.requireNonNull(properties);
    }

    @Override
    public FetchResult fetchByConversationId(String conversationId) {
        String body = get(CONVERSATIONS_PATH + "/{id}", conversationId);
        if (body == null) {
            return FetchResult.notFound("conversation " + conversationId + " unknown to provider");
        }
        return classify(parseObject(body), body);
    }

    @Override
    public List<String> listRecentConversationIds() {
        if (properties.getAgentId().isBlank()) {
            throw new NonRetryableCallException("voice.provider.agent-id not configured");
        }
        String list = get(CONVERSATIONS_PATH + "?agent_id={agent}&page_size={size}",
                properties.getAgentId(), properties.getPageSize());
        JSONArray conversations = list == null ? null : parseObject(list).optJSONArray("conversations");
        if (conversations == null) {
            return List.of();
        }
        List<String> ids = new ArrayList<>(conversations.length());
        for (int i = 0; i < conversations.length(); i++) {
            JSONObject summary = conversations.optJSONObject(i);
            String id = summary == null ? null : summary.optString("conversation_id", null);
            if (id != null && !id.isBlank()) {
                ids.add(id);
            }
        }
        return ids;
    }

    private FetchResult classify(JSONObject obj, String raw) {
        String status = obj.optString("status", "");
        TranscriptEvent event = TranscriptPayloadParser.fromConversation(obj, raw);
        if (!STATUS_DONE.equalsIgnoreCase(status)) {
            return FetchResult.inProgress(event, "provider status '" + status + "'");
        }
        return FetchResult.found(event);
    }

    /**
     * @return the body, or null on 404
     */
    private String get(String uriTemplate, Object... vars) {
        try {
            return restTemplate.getForObject(uriTemplate, String.class, vars);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return null;
            }
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw e;
            }
            LOG.warn("Voice provider rejected {}: {}", uriTemplate, e.getStatusCode());
            throw new NonRetryableCallException("Voice provider rejected request: " + e.getStatusCode(), e);
        }
    }

    private static JSONObject parseObject(String body) {
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new IllegalStateException("Malformed voice provider response", e);
        }
    }
}
