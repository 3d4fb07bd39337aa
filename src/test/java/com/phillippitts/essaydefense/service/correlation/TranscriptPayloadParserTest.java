package com.phillippitts.essaydefense.service.correlation;

import com.phillippitts.essaydefense.domain.Speaker;
import com.phillippitts.essaydefense.exception.MalformedPayloadException;
import com.phillippitts.essaydefense.service.exclusion.ExclusionPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptPayloadParserTest {

    @Test
    void parsesFlatShape() {
        String json = """
                {"conversation_id": "conv-1", "session_id": "s1", "call_duration_secs": 95.6,
                 "transcript": [{"role": "agent", "message": "Hello"}, {"role": "user", "message": "Hi"}]}
                """;

        TranscriptEvent e = TranscriptPayloadParser.parse(json);

        assertThat(e.conversationId()).isEqualTo("conv-1");
        assertThat(e.claimedSessionId()).isEqualTo("s1");
        assertThat(e.callDurationSeconds()).isEqualTo(95);
        assertThat(e.turns()).extracting(t -> t.speaker()).containsExactly(Speaker.EXAMINER, Speaker.STUDENT);
        assertThat(e.rawPayload()).isEqualTo(json);
    }

    @Test
    void parsesProviderEnvelope() {
        String json = """
                {"type": "post_call_transcription",
                 "data": {"conversation_id": "conv-2",
                          "metadata": {"call_duration_secs": 240},
                          "conversation_initiation_client_data": {"dynamic_variables": {"session_id": "s2"}},
                          "transcript": [{"role": "agent", "message": "Welcome"}]}}
                """;

        TranscriptEvent e = TranscriptPayloadParser.parse(json);

        assertThat(e.conversationId()).isEqualTo("conv-2");
        assertThat(e.claimedSessionId()).isEqualTo("s2");
        assertThat(e.callDurationSeconds()).isEqualTo(240);
        assertThat(e.turns()).hasSize(1);
    }

    @Test
    void fractionalDurationJustUnderTheMinimumStaysExcluded() {
        TranscriptEvent e = TranscriptPayloadParser.parse("""
                {"conversation_id": "conv-3", "call_duration_secs": "59.6", "transcript": []}
                """);

        assertThat(e.callDurationSeconds()).isEqualTo(59);
        assertThat(new ExclusionPolicy(60).isExcluded(e.callDurationSeconds())).isTrue();
    }

    @Test
    void toleratesMissingFields() {
        TranscriptEvent e = TranscriptPayloadParser.parse("{\"session_id\": \"  \", \"transcript\": [null, {}]}");

        assertThat(e.conversationId()).isNull();
        assertThat(e.claimedSessionId()).isNull();
        assertThat(e.callDurationSeconds()).isNull();
        assertThat(e.turns()).singleElement().satisfies(t -> {
            assertThat(t.speaker()).isEqualTo(Speaker.STUDENT);
            assertThat(t.message()).isEmpty();
        });
    }

    @Test
    void nonObjectBodyIsRejected() {
        assertThatThrownBy(() -> TranscriptPayloadParser.parse("[]")).isInstanceOf(MalformedPayloadException.class);
        assertThatThrownBy(() -> TranscriptPayloadParser.parse("")).isInstanceOf(MalformedPayloadException.class);
    }
}
