package com.phillippitts.essaydefense.service.recovery;

/**
 * Counts from one recovery sweep.
 *
 * @param examined   submissions inside the window that were looked up
 * @param recovered  transcripts attached by this sweep
 * @param notFound   provider had no conversation
 * @param inProgress conversation still running
 * @param failed     lookups or updates that failed; retried on the next sweep
 * @param aborted    true if the sweep was interrupted before finishing
 */
public record RecoverySummary(int examined, int recovered, int notFound, int inProgress, int failed,
                              boolean aborted) {
}
