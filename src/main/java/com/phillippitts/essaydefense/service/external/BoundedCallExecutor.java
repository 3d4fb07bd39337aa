package com.phillippitts.essaydefense.service.external;

import com.phillippitts.essaydefense.config.properties.ExternalCallProperties;
import com.phillippitts.essaydefense.exception.ExternalServiceException;
import com.phillippitts.essaydefense.exception.ExternalServiceExceptionBuilder;
import com.phillippitts.essaydefense.service.metrics.DefenseMetrics;
import com.phillippitts.essaydefense.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs external calls with a per-attempt timeout and a fixed attempt budget.
 *
 * <p><b>Thread Model:</b> each attempt runs on the {@code externalCallExecutor} pool while the caller
 * waits with {@link CompletableFuture#get(long, TimeUnit)}. A timed-out attempt is cancelled
 * best-effort; the HTTP client's own read timeout closes the socket shortly after.
 *
 * <p><b>Retry:</b> timeouts and errors are retried until {@code threadpool.external.max-attempts}
 * is spent (2 by default, so a single retry). Callers get a {@link CallResult} and decide whether a
 * failure is fatal; {@link #callOrThrow} converts failures into {@link ExternalServiceException}.
 *
 * <p>A {@link NonRetryableCallException} thrown by the call ends the loop immediately.
 */
@Component
public class BoundedCallExecutor {

    private static final Logger LOG = LogManager.getLogger(BoundedCallExecutor.class);

    private final Executor executor;
    private final int maxAttempts;
    private final DefenseMetrics metrics;

    public BoundedCallExecutor(@Qualifier("externalCallExecutor") Executor executor,
                               ExternalCallProperties properties,
                               DefenseMetrics metrics) {
        this.executor = Objects.requireNonNull(executor);
        this.maxAttempts = Math.max(1, properties.getMaxAttempts());
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Runs {@code call} with at most the configured number of attempts.
     *
     * @param service   name used in logs and metrics
     * @param timeoutMs per-attempt timeout in milliseconds
     * @param call      the blocking call
     * @return typed outcome; never throws for call failures
     */
    public <T> CallResult<T> call(String service, long timeoutMs, Supplier<T> call) {
        Objects.requireNonNull(call, "call");
        long t0 = System.nanoTime();
        CallResult<T> result = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            result = attempt(service, timeoutMs, call, attempt);
            if (result.isSuccess() || result.error() instanceof NonRetryableCallException) {
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            if (attempt < maxAttempts) {
                LOG.warn("{} attempt {}/{} ended with {}, retrying", service, attempt, maxAttempts,
                        result.outcome());
            }
        }
        metrics.recordExternalCall(service, result.outcome().name(), System.nanoTime() - t0);
        return result;
    }

    /**
     * Like {@link #call} but throws when the budget is spent.
     *
     * @throws ExternalServiceException on timeout or error after all attempts
     */
    public <T> T callOrThrow(String service, long timeoutMs, Supplier<T> call) {
        long t0 = System.nanoTime();
        CallResult<T> result = call(service, timeoutMs, call);
        if (result.isSuccess()) {
            return result.value();
        }
        Throwable cause = result.error() instanceof NonRetryableCallException nr && nr.getCause() != null
                ? nr.getCause()
                : result.error();
        throw ExternalServiceExceptionBuilder.create(service + " call failed")
                .service(service)
                .attempts(result.attempts())
                .outcome(result.outcome().name())
                .durationMs(TimeUtils.elapsedMillis(t0))
                .metadata("timeoutMs", timeoutMs)
                .cause(cause)
                .build();
    }

    private <T> CallResult<T> attempt(String service, long timeoutMs, Supplier<T> call, int attempt) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return CallResult.success(future.get(timeoutMs, TimeUnit.MILLISECONDS), attempt);
        } catch (TimeoutException te) {
            LOG.warn("{} timed out after {} ms (attempt {})", service, timeoutMs, attempt);
            future.cancel(true);
            return CallResult.timeout(attempt);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return CallResult.error(ie, attempt);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause() != null ? ee.getCause() : ee;
            LOG.warn("{} failed (attempt {}): {}", service, attempt, cause.toString());
            return CallResult.error(cause, attempt);
        }
    }
}
