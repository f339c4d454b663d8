package com.phillippitts.audio2video.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes conversion worker pool metrics via Micrometer.
 *
 * <ul>
 *   <li>conversion.pool.size - Current number of worker threads</li>
 *   <li>conversion.pool.active - Workers currently draining the queue</li>
 *   <li>conversion.pool.queued - Worker tasks waiting for a thread</li>
 *   <li>conversion.pool.completed - Cumulative count of finished worker tasks</li>
 *   <li>conversion.pool.max.size - Configured concurrency limit</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> conversionExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("conversionExecutor") ObjectProvider<ThreadPoolTaskExecutor> conversionExecutorProvider) {
        this.conversionExecutorProvider = conversionExecutorProvider;
    }

    @Bean
    public MeterBinder conversionExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.conversionExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("conversion.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of conversion worker threads")
                    .register(registry);

            Gauge.builder("conversion.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of workers actively converting")
                    .register(registry);

            Gauge.builder("conversion.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of worker tasks waiting for a thread")
                    .register(registry);

            Gauge.builder("conversion.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of finished worker tasks")
                    .register(registry);

            Gauge.builder("conversion.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured conversion concurrency limit")
                    .register(registry);

            LOG.debug("Conversion pool metrics registered: conversion.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = this.conversionExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Conversion pool: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
