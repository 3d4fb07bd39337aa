package com.phillippitts.essaydefense.service.grading;

import com.phillippitts.essaydefense.config.properties.GradingProperties;
import com.phillippitts.essaydefense.service.external.NonRetryableCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.DefaultUriBuilderFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpGradingClientTest {

    private static final String BASE = "http://grading.test";

    private MockRestServiceServer server;
    private HttpGradingClient client;

    @BeforeEach
    void setUp() {
        RestTemplate rest = new RestTemplate();
        rest.setUriTemplateHandler(new DefaultUriBuilderFactory(BASE));
        server = MockRestServiceServer.bindTo(rest).build();
        client = new HttpGradingClient(rest,
                new GradingProperties(null, "key", "test-model", 500, null));
    }

    @Test
    void sendsMessagesRequestAndReadsText() {
        server.expect(requestTo(BASE + HttpGradingClient.MESSAGES_PATH))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.max_tokens").value(500))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[0].content").value("PROMPT"))
                .andRespond(withSuccess("{\"content\":[{\"type\":\"text\",\"text\":\"Final multiplier: 1.01\"}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.complete("PROMPT")).isEqualTo("Final multiplier: 1.01");
        server.verify();
    }

    @Test
    void badRequestIsNotRetryable() {
        server.expect(requestTo(BASE + HttpGradingClient.MESSAGES_PATH)).andRespond(withStatus(HttpStatus.BAD_REQUEST));

        assertThatThrownBy(() -> client.complete("PROMPT")).isInstanceOf(NonRetryableCallException.class);
    }

    @Test
    void rateLimitStaysRetryable() {
        server.expect(requestTo(BASE + HttpGradingClient.MESSAGES_PATH))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.complete("PROMPT")).isInstanceOf(HttpClientErrorException.class);
    }

    @Test
    void responseWithoutTextIsAnError() {
        assertThatThrownBy(() -> HttpGradingClient.extractText("{\"content\":[]}"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> HttpGradingClient.extractText("not json"))
                .isInstanceOf(IllegalStateException.class);
    }
}
