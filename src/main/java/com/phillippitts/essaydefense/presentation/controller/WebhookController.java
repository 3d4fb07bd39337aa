package com.phillippitts.essaydefense.presentation.controller;

import com.phillippitts.essaydefense.service.correlation.CorrelationEngine;
import com.phillippitts.essaydefense.service.correlation.CorrelationOutcome;
import com.phillippitts.essaydefense.service.correlation.TranscriptEvent;
import com.phillippitts.essaydefense.service.correlation.TranscriptPayloadParser;
import com.phillippitts.essaydefense.service.correlation.WebhookAuthenticator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives finished-conversation webhooks from the voice provider.
 *
 * <p>The secret is checked before the body is parsed, so a rejected call changes nothing.
 * Matched and duplicate deliveries answer 200 so the provider stops retrying; a conflict answers
 * 409 and an unmatched transcript 422.
 */
@RestController
@RequestMapping("/api/webhooks")
class WebhookController {

    private static final Logger LOG = LogManager.getLogger(WebhookController.class);

    private final WebhookAuthenticator authenticator;
    private final CorrelationEngine correlation;

    WebhookController(WebhookAuthenticator authenticator, CorrelationEngine correlation) {
        this.authenticator = authenticator;
        this.correlation = correlation;
    }

    @PostMapping("/transcript")
    ResponseEntity<CorrelationOutcome> transcript(@RequestParam(name = "secret", required = false) String secret,
                                                  @RequestBody(required = false) String body) {
        authenticator.verify(secret);
        TranscriptEvent event = TranscriptPayloadParser.parse(body);
        LOG.info("Transcript webhook: conversation={}, claimedSession={}, turns={}, duration={}",
                event.conversationId(), event.claimedSessionId(), event.turns().size(),
                event.callDurationSeconds());
        CorrelationOutcome outcome = correlation.correlate(event);
        return ResponseEntity.status(httpStatus(outcome.status())).body(outcome);
    }

    static HttpStatus httpStatus(CorrelationOutcome.Status status) {
        return switch (status) {
            case MATCHED, DUPLICATE_IGNORED -> HttpStatus.OK;
            case CONFLICT -> HttpStatus.CONFLICT;
            case NO_MATCH -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }
}
