package com.phillippitts.audio2video.config.orchestration;

import com.phillippitts.audio2video.config.properties.ConversionProperties;
import com.phillippitts.audio2video.domain.JobStateMachine;
import com.phillippitts.audio2video.service.encoder.ConversionExecutor;
import com.phillippitts.audio2video.service.metrics.ConversionMetrics;
import com.phillippitts.audio2video.service.naming.OutputPathResolver;
import com.phillippitts.audio2video.service.orchestration.ConversionController;
import com.phillippitts.audio2video.service.orchestration.ConversionControllerBuilder;
import com.phillippitts.audio2video.service.probe.DurationResolver;
import com.phillippitts.audio2video.service.queue.JobQueue;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the {@link ConversionController} explicitly so the worker pool is picked by name.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public JobStateMachine jobStateMachine() {
        return new JobStateMachine();
    }

    @Bean
    public ConversionController conversionController(JobQueue queue,
                                                     JobStateMachine jobStateMachine,
                                                     DurationResolver durationResolver,
                                                     OutputPathResolver outputPathResolver,
                                                     ConversionExecutor conversionExecutorService,
                                                     ApplicationEventPublisher publisher,
                                                     @Qualifier("conversionExecutor") Executor workerPool,
                                                     ConversionMetrics metrics,
                                                     ConversionProperties properties) {
        return ConversionControllerBuilder.builder()
                .queue(queue)
                .stateMachine(jobStateMachine)
                .durationResolver(durationResolver)
                .pathResolver(outputPathResolver)
                .executor(conversionExecutorService)
                .publisher(publisher)
                .workerExecutor(workerPool)
                .metrics(metrics)
                .outputDirectory(properties.resolveOutputDirectory())
                .concurrency(properties.getConcurrency())
                .logTailLines(properties.getLogTailLines())
                .build();
    }
}
