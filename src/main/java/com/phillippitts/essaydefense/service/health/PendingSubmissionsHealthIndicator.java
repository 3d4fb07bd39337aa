package com.phillippitts.essaydefense.service.health;

import com.phillippitts.essaydefense.config.properties.RecoveryProperties;
import com.phillippitts.essaydefense.domain.Submission;
import com.phillippitts.essaydefense.domain.SubmissionStatus;
import com.phillippitts.essaydefense.store.SubmissionStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Health indicator for submissions that need operator attention.
 *
 * <ul>
 *   <li>UP: no submission is stuck</li>
 *   <li>DEGRADED: some submissions are still waiting for a transcript past the lookback window, so
 *       recovery no longer looks for them</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class PendingSubmissionsHealthIndicator implements HealthIndicator {

    private final SubmissionStore store;
    private final RecoveryProperties recovery;
    private final Clock clock;

    public PendingSubmissionsHealthIndicator(SubmissionStore store, RecoveryProperties recovery, Clock clock) {
        this.store = store;
        this.recovery = recovery;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Instant cutoff = clock.instant().minus(recovery.lookbackWindow());
        List<Submission> awaiting = store.findByStatus(SubmissionStatus.AWAITING_TRANSCRIPT);
        long stuck = awaiting.stream().filter(s -> !s.createdAt().isAfter(cutoff)).count();
        int awaitingGrading = store.findByStatus(EnumSet.of(SubmissionStatus.DEFENSE_COMPLETE)).size();

        Health.Builder builder = stuck == 0 ? Health.up() : Health.status("DEGRADED");
        return builder
                .withDetail("awaitingTranscript", awaiting.size())
                .withDetail("stuck", stuck)
                .withDetail("awaitingGrading", awaitingGrading)
                .withDetail("recoveryEnabled", recovery.isEnabled())
                .build();
    }
}
