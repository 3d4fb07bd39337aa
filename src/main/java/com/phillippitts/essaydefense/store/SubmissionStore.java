package com.phillippitts.essaydefense.store;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.domain.SubmissionStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keyed table of submissions.
 *
 * <p><b>Atomicity contract:</b> {@link #update(String, UnaryOperator)} is read-modify-write atomic
 * per session id. Two concurrent updates to the same id run one after the other, each seeing the
 * other's result; updates to different ids do not block each other.
 *
 * <p><b>Ownership contract:</b> a conversation id belongs to at most one submission. An update that
 * would hand an owned conversation id to another submission fails and leaves the record untouched.
 */
public interface SubmissionStore {

    /**
     * Inserts a new submission.
     *
     * @throws IllegalStateException if the session id is already taken
     */
    void insert(Submission submission);

    Optional<Submission> findBySessionId(String sessionId);

    Optional<Submission> findByConversationId(String conversationId);

    /**
     * Returns submissions whose status is one of {@code statuses}, oldest first.
     */
    List<Submission> findByStatus(Collection<SubmissionStatus> statuses);

    List<Submission> findAll();

    /**
     * Atomically replaces the submission with the mutation's result. Returning the same instance
     * from the mutation is a no-op write.
     *
     * @param sessionId submission to update
     * @param mutation  pure function from current snapshot to next snapshot; must keep the session id
     * @return the snapshot stored after the update
     * @throws com.phillippitts.essaydefense.exception.SubmissionNotFoundException if no such submission
     * @throws com.phillippitts.essaydefense.exception.ConversationAlreadyClaimedException if the new
     *         conversation id belongs to a different submission
     */
    Submission update(String sessionId, UnaryOperator<Submission> mutation);
}
