package com.phillippitts.essaydefense.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ExternalServiceException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ExternalServiceExceptionBuilder.create("Grading call failed")
 *         .service("grading-ai")
 *         .attempts(2)
 *         .outcome("TIMEOUT")
 *         .metadata("sessionId", sessionId)
 *         .cause(lastError)
 *         .build();
 * </pre>
 */
public final class ExternalServiceExceptionBuilder {

    private final String message;
    private String serviceName;
    private Throwable cause;
    private int attempts;
    private String outcome;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ExternalServiceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ExternalServiceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ExternalServiceExceptionBuilder(message);
    }

    public ExternalServiceExceptionBuilder service(String serviceName) {
        this.serviceName = serviceName;
        return this;
    }

    public ExternalServiceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ExternalServiceExceptionBuilder attempts(int attempts) {
        this.attempts = attempts;
        return this;
    }

    /**
     * Sets the outcome of the final attempt (e.g. TIMEOUT, ERROR).
     */
    public ExternalServiceExceptionBuilder outcome(String outcome) {
        this.outcome = outcome;
        return this;
    }

    public ExternalServiceExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public ExternalServiceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (attempts={n}, outcome={o}, durationMs={ms}, {key1}={val1}, ...) (service: {name})
     * </pre>
     *
     * @return constructed ExternalServiceException
     */
    public ExternalServiceException build() {
        String detailedMessage = buildDetailedMessage();
        String service = serviceName != null ? serviceName : "unknown";

        if (cause != null) {
            return new ExternalServiceException(detailedMessage, service, attempts, cause);
        }
        return new ExternalServiceException(detailedMessage, service, attempts);
    }

    private String buildDetailedMessage() {
        StringBuilder sb = new StringBuilder(message);

        boolean hasDetails = attempts > 0 || outcome != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        sb.append(" (");
        boolean first = true;

        if (attempts > 0) {
            sb.append("attempts=").append(attempts);
            first = false;
        }
        if (outcome != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("outcome=").append(outcome);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
