package com.phillippitts.essaydefense.service.correlation;

import com.phillippitts.essaydefense.config.properties.WebhookProperties;
import com.phillippitts.essaydefense.exception.WebhookAuthenticationException;
import com.phillippitts.essaydefense.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the shared secret on inbound webhooks in constant time.
 *
 * <p>Fails closed: with no secret configured every webhook is rejected.
 */
@Component
public class WebhookAuthenticator {

    private static final Logger LOG = LogManager.getLogger(WebhookAuthenticator.class);

    private final WebhookProperties properties;

    public WebhookAuthenticator(WebhookProperties properties) {
        this.properties = properties;
        if (!properties.isConfigured()) {
            LOG.warn("defense.webhook.secret is not set; all transcript webhooks will be rejected");
        }
    }

    /**
     * @throws WebhookAuthenticationException if the secret is missing or wrong
     */
    public void verify(String presentedSecret) {
        if (!properties.isConfigured()) {
            throw new WebhookAuthenticationException("Webhook secret not configured");
        }
        if (presentedSecret == null || presentedSecret.isEmpty()) {
            throw new WebhookAuthenticationException("Missing webhook secret");
        }
        byte[] expected = properties.getSecret().getBytes(StandardCharsets.UTF_8);
        byte[] presented = presentedSecret.getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, presented)) {
            LOG.debug("Webhook secret mismatch: presented {}", LogSanitizer.mask(presentedSecret));
            throw new WebhookAuthenticationException("Invalid webhook secret");
        }
    }
}
