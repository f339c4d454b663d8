package com.phillippitts.audio2video.service.orchestration;

import com.phillippitts.audio2video.domain.ConversionJob;
import com.phillippitts.audio2video.domain.JobStateMachine;
import com.phillippitts.audio2video.service.encoder.ConversionExecutor;
import com.phillippitts.audio2video.service.metrics.ConversionMetrics;
import com.phillippitts.audio2video.service.naming.OutputPathResolver;
import com.phillippitts.audio2video.service.probe.DurationResolver;
import com.phillippitts.audio2video.service.queue.JobQueue;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultConversionController} to simplify construction with many dependencies.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ConversionController controller = ConversionControllerBuilder.builder()
 *     .queue(queue)
 *     .stateMachine(stateMachine)
 *     .durationResolver(resolver)
 *     .pathResolver(pathResolver)
 *     .executor(ffmpegExecutor)
 *     .publisher(publisher)
 *     .workerExecutor(conversionPool)
 *     .metrics(metrics)
 *     .outputDirectory(Path.of("exports"))
 *     .concurrency(2)
 *     .build();
 * }</pre>
 *
 * @since 1.0
 */
public final class ConversionControllerBuilder {

    // Required dependencies
    JobQueue queue;
    JobStateMachine stateMachine;
    DurationResolver durationResolver;
    OutputPathResolver pathResolver;
    ConversionExecutor executor;
    ApplicationEventPublisher publisher;
    Executor workerExecutor;
    ConversionMetrics metrics;
    Path outputDirectory;

    // Optional settings
    int concurrency = 1;
    int logTailLines = ConversionJob.DEFAULT_LOG_TAIL_LINES;

    private ConversionControllerBuilder() {
        // Private constructor - use builder() factory method
    }

    public static ConversionControllerBuilder builder() {
        return new ConversionControllerBuilder();
    }

    public ConversionControllerBuilder queue(JobQueue queue) {
        this.queue = queue;
        return this;
    }

    public ConversionControllerBuilder stateMachine(JobStateMachine stateMachine) {
        this.stateMachine = stateMachine;
        return this;
    }

    public ConversionControllerBuilder durationResolver(DurationResolver durationResolver) {
        this.durationResolver = durationResolver;
        return this;
    }

    public ConversionControllerBuilder pathResolver(OutputPathResolver pathResolver) {
        this.pathResolver = pathResolver;
        return this;
    }

    public ConversionControllerBuilder executor(ConversionExecutor executor) {
        this.executor = executor;
        return this;
    }

    public ConversionControllerBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public ConversionControllerBuilder workerExecutor(Executor workerExecutor) {
        this.workerExecutor = workerExecutor;
        return this;
    }

    public ConversionControllerBuilder metrics(ConversionMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    public ConversionControllerBuilder outputDirectory(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
        return this;
    }

    /**
     * Maximum jobs running at once (W).
     */
    public ConversionControllerBuilder concurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    public ConversionControllerBuilder logTailLines(int logTailLines) {
        this.logTailLines = logTailLines;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     * @throws IllegalArgumentException if a numeric setting is not positive
     */
    public DefaultConversionController build() {
        Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        Objects.requireNonNull(durationResolver, "durationResolver must not be null");
        Objects.requireNonNull(pathResolver, "pathResolver must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(publisher, "publisher must not be null");
        Objects.requireNonNull(workerExecutor, "workerExecutor must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (logTailLines <= 0) {
            throw new IllegalArgumentException("logTailLines must be > 0");
        }
        return new DefaultConversionController(this);
    }
}
