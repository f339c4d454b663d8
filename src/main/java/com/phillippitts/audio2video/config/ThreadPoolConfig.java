package com.phillippitts.audio2video.config;

import com.phillippitts.audio2video.config.properties.ConversionProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs conversion workers.
 *
 * <p>Pool size equals {@code conversion.concurrency} (W). Each worker drains the job queue
 * until no Queued job is left, so at most W tasks are ever submitted at a time.
 */
@Configuration
public class ThreadPoolConfig {

    /** Extra slots so a worker that is finishing does not cause a restart to be rejected. */
    private static final int QUEUE_HEADROOM = 4;

    private final ConversionProperties conversionProperties;

    public ThreadPoolConfig(ConversionProperties conversionProperties) {
        this.conversionProperties = conversionProperties;
    }

    /**
     * Creates the conversion worker pool.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Control operations must return
     * immediately, so the submitting thread never runs a job itself.
     *
     * <p>Shutdown waits for running workers; cancellation of their encoders is bounded by the
     * configured grace period.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread.
     *
     * @return Configured executor for conversion workers
     */
    @Bean(name = "conversionExecutor")
    public ThreadPoolTaskExecutor conversionExecutor() {
        int workers = conversionProperties.getConcurrency();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(workers + QUEUE_HEADROOM);
        executor.setThreadNamePrefix(conversionProperties.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
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
        };
    }
}
