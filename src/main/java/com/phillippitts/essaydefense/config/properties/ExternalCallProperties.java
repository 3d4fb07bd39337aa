package com.phillippitts.essaydefense.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pool sizing and call budget for outbound calls to the voice provider and grading AI.
 */
@ConfigurationProperties(prefix = "threadpool.external")
@Validated
public class ExternalCallProperties {

    @Positive
    private int corePoolSize = 4;

    @Positive
    private int maxPoolSize = 8;

    @Min(0)
    private int queueCapacity = 100;

    @Positive
    private int keepAliveSeconds = 60;

    private String threadNamePrefix = "external-call-";

    /** Per-attempt timeout for voice provider calls, in milliseconds. */
    @Positive
    private long voiceTimeoutMs = 15_000;

    /** Per-attempt timeout for grading calls, in milliseconds. Grading responses are long. */
    @Positive
    private long gradingTimeoutMs = 90_000;

    /** Total attempts per call, so 2 means one retry. */
    @Min(1)
    @Max(5)
    private int maxAttempts = 2;

    public int getCorePoolSize() {
        return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
        this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getKeepAliveSeconds() {
        return keepAliveSeconds;
    }

    public void setKeepAliveSeconds(int keepAliveSeconds) {
        this.keepAliveSeconds = keepAliveSeconds;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    public long getVoiceTimeoutMs() {
        return voiceTimeoutMs;
    }

    public void setVoiceTimeoutMs(long voiceTimeoutMs) {
        this.voiceTimeoutMs = voiceTimeoutMs;
    }

    public long getGradingTimeoutMs() {
        return gradingTimeoutMs;
    }

    public void setGradingTimeoutMs(long gradingTimeoutMs) {
        this.gradingTimeoutMs = gradingTimeoutMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }
}
