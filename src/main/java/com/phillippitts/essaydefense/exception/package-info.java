/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.essaydefense.exception.EssayDefenseException}
 * and are mapped to HTTP responses by
 * {@code com.phillippitts.essaydefense.presentation.exception.GlobalExceptionHandler}.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.essaydefense.exception.EssayTooLongException} and
 *       {@link com.phillippitts.essaydefense.exception.InvalidSubmissionException} - validation
 *       errors, reported to the caller, no record is created</li>
 *   <li>{@link com.phillippitts.essaydefense.exception.WebhookAuthenticationException} - bad
 *       shared secret on the transcript webhook, no state change</li>
 *   <li>{@link com.phillippitts.essaydefense.exception.SubmissionNotFoundException} - unknown
 *       session id</li>
 *   <li>{@link com.phillippitts.essaydefense.exception.IllegalStatusTransitionException} - a status
 *       change that would break the forward-only lifecycle</li>
 *   <li>{@link com.phillippitts.essaydefense.exception.GradingException} - grading precondition
 *       not met (no transcript)</li>
 *   <li>{@link com.phillippitts.essaydefense.exception.ExternalServiceException} - voice provider
 *       or grading AI unreachable after the retry budget</li>
 * </ul>
 *
 * <p>An unmatched transcript is not an exception: it is reported as a
 * {@code CorrelationOutcome} so the webhook can answer with a distinct status.
 *
 * @since 1.0
 */
package com.phillippitts.essaydefense.exception;
