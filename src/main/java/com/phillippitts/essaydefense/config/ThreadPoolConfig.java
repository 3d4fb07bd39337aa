package com.phillippitts.essaydefense.config;

import com.phillippitts.essaydefense.config.properties.ExternalCallProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for outbound calls to the voice provider and the grading AI.
 *
 * <p>Calls run on this pool so the caller can wait with a timeout and walk away from a hung
 * connection. Sizing comes from {@code threadpool.external.*}.
 */
@Configuration
public class ThreadPoolConfig {

    private final ExternalCallProperties properties;

    public ThreadPoolConfig(ExternalCallProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates the bounded executor for external calls.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When pool and queue are
     * full the caller runs the call itself, which slows sweeps down instead of dropping work.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext (requestId, sessionId) from the
     * submitting thread to the worker.
     *
     * @return executor for external calls
     */
    @Bean(name = "externalCallExecutor")
    public Executor externalCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCorePoolSize());
        executor.setMaxPoolSize(properties.getMaxPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix(properties.getThreadNamePrefix());
        executor.setKeepAliveSeconds(properties.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.setTaskDecorator(runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        });

        executor.initialize();
        return executor;
    }
}
