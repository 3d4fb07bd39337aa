package com.phillippitts.essaydefense.service.correlation.event;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes unmatched transcript payloads to the dedicated {@code essaydefense.unmatched} logger, which
 * log4j2-spring.xml routes to its own file for manual reconciliation.
 */
@Component
class CorrelationEventsListener {

    static final String UNMATCHED_LOGGER = "essaydefense.unmatched";

    private static final Logger LOG = LogManager.getLogger(CorrelationEventsListener.class);
    private static final Logger UNMATCHED = LogManager.getLogger(UNMATCHED_LOGGER);

    @EventListener
    void onUnmatched(UnmatchedTranscriptEvent e) {
        LOG.warn("Transcript could not be correlated: conversationId={}, claimedSessionId={}",
                e.conversationId(), e.claimedSessionId());
        UNMATCHED.error("at={} conversationId={} claimedSessionId={} payload={}",
                e.at(), e.conversationId(), e.claimedSessionId(), e.rawPayload());
    }

    @EventListener
    void onCorrelated(TranscriptCorrelatedEvent e) {
        LOG.info("Transcript attached: sessionId={}, conversationId={}, method={}, status={}",
                e.sessionId(), e.conversationId(), e.method(), e.status());
    }
}
