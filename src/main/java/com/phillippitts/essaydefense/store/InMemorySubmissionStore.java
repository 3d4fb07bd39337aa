package com.phillippitts.essaydefense.store;

import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.exception.ConversationAlreadyClaimedException;
import com.phillippitts.essaydefense.exception.IllegalStatusTransitionException;
import com.phillippitts.essaydefense.exception.SubmissionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link SubmissionStore} with per-session locking.
 *
 * <p>Each session id gets its own {@link ReentrantLock}; an update holds only that lock, so updates
 * for different submissions proceed in parallel. Conversation ownership is claimed with
 * {@link ConcurrentMap#putIfAbsent} while the session lock is held.
 *
 * <p>Status changes must follow {@link SubmissionStatus#canAdvanceTo} or
 * {@link SubmissionStatus#canOverrideTo}; anything else is rejected before the write.
 */
@Component
public class InMemorySubmissionStore implements SubmissionStore {

    private static final Logger LOG = LogManager.getLogger(InMemorySubmissionStore.class);

    private static final Comparator<Submission> OLDEST_FIRST =
            Comparator.comparing(Submission::createdAt).thenComparing(Submission::sessionId);

    private final ConcurrentMap<String, Submission> records = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> conversationOwners = new ConcurrentHashMap<>();

    @Override
    public void insert(Submission submission) {
        Objects.requireNonNull(submission, "submission");
        ReentrantLock lock = lockFor(submission.sessionId());
        lock.lock();
        try {
            if (records.putIfAbsent(submission.sessionId(), submission) != null) {
                throw new IllegalStateException("Session id already in use: " + submission.sessionId());
            }
            if (submission.conversationId() != null) {
                claimConversation(submission.conversationId(), submission.sessionId());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Submission> findBySessionId(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(sessionId));
    }

    @Override
    public Optional<Submission> findByConversationId(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        String owner = conversationOwners.get(conversationId);
        return owner == null ? Optional.empty() : findBySessionId(owner);
    }

    @Override
    public List<Submission> findByStatus(Collection<SubmissionStatus> statuses) {
        Set<SubmissionStatus> wanted = statuses.isEmpty()
                ? EnumSet.noneOf(SubmissionStatus.class)
                : EnumSet.copyOf(statuses);
        return records.values().stream()
                .filter(s -> wanted.contains(s.status()))
                .sorted(OLDEST_FIRST)
                .toList();
    }

    @Override
    public List<Submission> findAll() {
        return records.values().stream().sorted(OLDEST_FIRST).toList();
    }

    @Override
    public Submission update(String sessionId, UnaryOperator<Submission> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            Submission current = records.get(sessionId);
            if (current == null) {
                throw new SubmissionNotFoundException(sessionId);
            }
            Submission next = mutation.apply(current);
            if (next == null || next == current) {
                return current;
            }
            if (!sessionId.equals(next.sessionId())) {
                throw new IllegalArgumentException("Update must not change the session id: " + sessionId);
            }
            if (current.status() != next.status()
                    && !current.status().canAdvanceTo(next.status())
                    && !current.status().canOverrideTo(next.status())) {
                throw new IllegalStatusTransitionException(sessionId, current.status(), next.status());
            }
            String newConversation = next.conversationId();
            if (newConversation != null && !newConversation.equals(current.conversationId())) {
                claimConversation(newConversation, sessionId);
            }
            records.put(sessionId, next);
            if (current.status() != next.status()) {
                LOG.debug("Submission {} status {} -> {}", sessionId, current.status(), next.status());
            }
            return next;
        } finally {
            lock.unlock();
        }
    }

    private void claimConversation(String conversationId, String sessionId) {
        String owner = conversationOwners.putIfAbsent(conversationId, sessionId);
        if (owner != null && !owner.equals(sessionId)) {
            throw new ConversationAlreadyClaimedException(conversationId, owner);
        }
    }

    private ReentrantLock lockFor(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        return locks.computeIfAbsent(sessionId, k -> new ReentrantLock());
    }
}
