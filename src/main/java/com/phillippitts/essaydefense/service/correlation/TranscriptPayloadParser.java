package com.phillippitts.essaydefense.service.correlation;

import com.phillippitts.essaydefense.domain.TranscriptTurn;
import com.phillippitts.essaydefense.exception.MalformedPayloadException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads voice provider JSON into {@link TranscriptEvent}s.
 *
 * <p>Accepts the flat webhook shape
 * {@code {transcript:[{role,message}], conversation_id, session_id, call_duration_secs}} and the
 * provider envelope {@code {data:{conversation_id, transcript, metadata:{call_duration_secs},
 * conversation_initiation_client_data:{dynamic_variables:{session_id}}}}}. Conversation detail
 * responses from the provider API use the envelope's inner shape and parse the same way.
 *
 * <p>Missing fields are tolerated: absent ids become null, absent duration is unknown, a missing
 * transcript is an empty turn list. Only a body that is not a JSON object is rejected.
 */
public final class TranscriptPayloadParser {

    private TranscriptPayloadParser() {}

    /**
     * @param json raw request body
     * @return parsed event carrying the raw body
     * @throws MalformedPayloadException if the body is not a JSON object
     */
    public static TranscriptEvent parse(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedPayloadException("Empty payload", null);
        }
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new MalformedPayloadException("Payload is not a JSON object", e);
        }
        JSONObject body = root.optJSONObject("data");
        return fromConversation(body != null ? body : root, json);
    }

    /**
     * Parses one conversation object (flat webhook body or provider conversation detail).
     */
    public static TranscriptEvent fromConversation(JSONObject obj, String rawPayload) {
        List<TranscriptTurn> turns = turns(obj.optJSONArray("transcript"));
        String conversationId = obj.optString("conversation_id", null);
        String sessionId = sessionToken(obj);
        Integer duration = duration(obj);
        return new TranscriptEvent(turns, conversationId, sessionId, duration, rawPayload);
    }

    /**
     * Correlation token echoed back by the provider, top-level or in the dynamic variables.
     */
    static String sessionToken(JSONObject obj) {
        String direct = obj.optString("session_id", null);
        if (direct != null && !direct.isBlank()) {
            return direct;
        }
        JSONObject init = obj.optJSONObject("conversation_initiation_client_data");
        JSONObject vars = init != null ? init.optJSONObject("dynamic_variables") : null;
        return vars != null ? vars.optString("session_id", null) : null;
    }

    private static Integer duration(JSONObject obj) {
        if (obj.has("call_duration_secs")) {
            return asInteger(obj.opt("call_duration_secs"));
        }
        JSONObject meta = obj.optJSONObject("metadata");
        if (meta != null && meta.has("call_duration_secs")) {
            return asInteger(meta.opt("call_duration_secs"));
        }
        return null;
    }

    private static Integer asInteger(Object value) {
        if (value instanceof Number n) {
            return (int) Math.floor(n.doubleValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return (int) Math.floor(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static List<TranscriptTurn> turns(JSONArray arr) {
        if (arr == null) {
            return List.of();
        }
        List<TranscriptTurn> turns = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject t = arr.optJSONObject(i);
            if (t == null) {
                continue;
            }
            turns.add(TranscriptTurn.of(t.optString("role", ""), t.optString("message", "")));
        }
        return turns;
    }
}
