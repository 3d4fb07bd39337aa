package com.phillippitts.essaydefense.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the stuck-submission recovery sweep.
 */
@ConfigurationProperties(prefix = "defense.recovery")
@Validated
public class RecoveryProperties {

    /** Enable/disable the scheduled sweep. On-demand sweeps always work. */
    private boolean enabled = true;

    /** Delay between scheduled sweeps, in milliseconds. */
    @Positive(message = "Recovery interval must be positive")
    private long intervalMs = 300_000;

    /** Delay before the first scheduled sweep, in milliseconds. */
    @Min(value = 0, message = "Initial delay must not be negative")
    private long initialDelayMs = 60_000;

    /** Submissions younger than this are left alone; their webhook may still arrive. */
    @Min(value = 0, message = "Grace minutes must not be negative")
    private int graceMinutes = 5;

    /** Submissions older than this are no longer polled. */
    @Positive(message = "Lookback hours must be positive")
    private int lookbackHours = 48;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
        this.intervalMs = intervalMs;
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public void setInitialDelayMs(long initialDelayMs) {
        this.initialDelayMs = initialDelayMs;
    }

    public int getGraceMinutes() {
        return graceMinutes;
    }

    public void setGraceMinutes(int graceMinutes) {
        this.graceMinutes = graceMinutes;
    }

    public int getLookbackHours() {
        return lookbackHours;
    }

    public void setLookbackHours(int lookbackHours) {
        this.lookbackHours = lookbackHours;
    }

    public Duration graceWindow() {
        return Duration.ofMinutes(graceMinutes);
    }

    public Duration lookbackWindow() {
        return Duration.ofHours(lookbackHours);
    }
}
