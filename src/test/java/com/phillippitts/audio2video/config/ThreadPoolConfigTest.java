package com.phillippitts.audio2video.config;

import com.phillippitts.audio2video.config.properties.ConversionProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
        ThreadContext.clearAll();
    }

    @Test
    void shouldSizePoolToConcurrency() {
        ConversionProperties properties = new ConversionProperties();
        properties.setConcurrency(3);

        executor = new ThreadPoolConfig(properties).conversionExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(3);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("conversion-");
    }

    @Test
    void shouldUseCorrectThreadNamePrefix() throws InterruptedException {
        executor = new ThreadPoolConfig(new ConversionProperties()).conversionExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).startsWith("conversion-");
    }

    @Test
    void shouldPropagateMdcToWorker() throws InterruptedException {
        executor = new ThreadPoolConfig(new ConversionProperties()).conversionExecutor();
        ThreadContext.put("requestId", "batch-7");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();

        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("batch-7");
    }

    @Test
    void shouldRejectWhenSaturated() throws InterruptedException {
        ConversionProperties properties = new ConversionProperties();
        properties.setConcurrency(1);
        executor = new ThreadPoolConfig(properties).conversionExecutor();
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        try {
            // one running plus queue capacity (1 + 4)
            for (int i = 0; i < 6; i++) {
                executor.execute(blocker);
            }
            assertThatThrownBy(() -> executor.execute(blocker))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
        }
    }
}
