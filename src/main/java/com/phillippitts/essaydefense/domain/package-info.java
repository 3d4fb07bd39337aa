/**
 * Domain models for essay submissions and their oral defenses.
 *
 * <p>All domain models are immutable records or enums, validate themselves in their
 * constructors, and carry no persistence concerns.
 *
 * <ul>
 *   <li>{@link com.phillippitts.essaydefense.domain.Submission} - one essay with its frozen
 *       questions, lifecycle status, transcript and grade</li>
 *   <li>{@link com.phillippitts.essaydefense.domain.SubmissionStatus} - forward-only lifecycle</li>
 *   <li>{@link com.phillippitts.essaydefense.domain.TranscriptTurn} - one utterance of a defense</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.essaydefense.domain;
