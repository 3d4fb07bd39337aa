package com.phillippitts.essaydefense.presentation.exception;

import com.phillippitts.essaydefense.exception.ConversationAlreadyClaimedException;
import com.phillippitts.essaydefense.exception.EssayTooLongException;
import com.phillippitts.essaydefense.exception.ExternalServiceException;
import com.phillippitts.essaydefense.exception.GradingException;
import com.phillippitts.essaydefense.exception.IllegalStatusTransitionException;
import com.phillippitts.essaydefense.exception.InvalidSubmissionException;
import com.phillippitts.essaydefense.exception.MalformedPayloadException;
import com.phillippitts.essaydefense.exception.SubmissionNotFoundException;
import com.phillippitts.essaydefense.exception.WebhookAuthenticationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Client errors carry the actionable message; 5xx responses never echo internal details.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - essay over the configured limit (HTTP 400).
     */
    @ExceptionHandler(EssayTooLongException.class)
    ResponseEntity<ApiError> handleEssayTooLong(EssayTooLongException ex) {
        LOG.warn("Essay rejected: {} chars, limit {}", ex.getActualLength(), ex.getMaxLength());
        return error(HttpStatus.BAD_REQUEST, ex, "Essay too long",
                "Essay has " + ex.getActualLength() + " characters; the limit is " + ex.getMaxLength());
    }

    /**
     * Client error - missing or invalid field (HTTP 400).
     */
    @ExceptionHandler(InvalidSubmissionException.class)
    ResponseEntity<ApiError> handleInvalidSubmission(InvalidSubmissionException ex) {
        LOG.warn("Invalid request: field={}", ex.getField());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler({MalformedPayloadException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleUnreadable(Exception ex) {
        LOG.warn("Unreadable request body: {}", ex.getClass().getSimpleName());
        return error(HttpStatus.BAD_REQUEST, ex, "Malformed request body", "Body must be a JSON object");
    }

    /**
     * Webhook secret missing or wrong (HTTP 401). Nothing was changed.
     */
    @ExceptionHandler(WebhookAuthenticationException.class)
    ResponseEntity<ApiError> handleWebhookAuth(WebhookAuthenticationException ex) {
        LOG.warn("Webhook rejected: {}", ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, ex, "Unauthorized", "Invalid or missing webhook secret");
    }

    @ExceptionHandler(SubmissionNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(SubmissionNotFoundException ex) {
        LOG.info("Unknown session: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex, "Submission not found", ex.getMessage());
    }

    /**
     * State conflict (HTTP 409): illegal transition, or a conversation owned by another submission.
     */
    @ExceptionHandler({IllegalStatusTransitionException.class, ConversationAlreadyClaimedException.class})
    ResponseEntity<ApiError> handleConflict(RuntimeException ex) {
        LOG.warn("Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex, "Conflict", ex.getMessage());
    }

    /**
     * Grading precondition failed (HTTP 422), e.g. no transcript yet.
     */
    @ExceptionHandler(GradingException.class)
    ResponseEntity<ApiError> handleGrading(GradingException ex) {
        LOG.warn("Grading refused: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex, "Cannot grade submission", ex.getMessage());
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(ExternalServiceException.class)
    ResponseEntity<ApiError> handleExternalFailure(ExternalServiceException ex) {
        LOG.error("External service failed: service={}, attempts={}", ex.getServiceName(), ex.getAttempts(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "External service temporarily unavailable",
                "Please retry later");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
