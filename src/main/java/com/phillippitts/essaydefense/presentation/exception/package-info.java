/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.essaydefense.exception.EssayTooLongException},
 *       {@link com.phillippitts.essaydefense.exception.InvalidSubmissionException} → 400</li>
 *   <li>{@link com.phillippitts.essaydefense.exception.WebhookAuthenticationException} → 401</li>
 *   <li>{@link com.phillippitts.essaydefense.exception.SubmissionNotFoundException} → 404</li>
 *   <li>{@link com.phillippitts.essaydefense.exception.IllegalStatusTransitionException} → 409</li>
 *   <li>{@link com.phillippitts.essaydefense.exception.GradingException} → 422</li>
 *   <li>{@link com.phillippitts.essaydefense.exception.ExternalServiceException} → 503</li>
 *   <li>{@code Exception} (catch-all) → 500</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "EssayTooLongException",
 *   "message": "Essay too long",
 *   "details": "Essay has 15204 characters; the limit is 15000",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.essaydefense.presentation.exception;
