package com.phillippitts.audio2video.service.encoder;

import com.phillippitts.audio2video.config.encoder.EncoderBinaryLocator;
import com.phillippitts.audio2video.config.properties.ConversionProperties;
import com.phillippitts.audio2video.domain.LogTail;
import com.phillippitts.audio2video.exception.ConversionErrorKind;
import com.phillippitts.audio2video.exception.ConversionException;
import com.phillippitts.audio2video.exception.ConversionExceptionBuilder;
import com.phillippitts.audio2video.service.process.DefaultProcessFactory;
import com.phillippitts.audio2video.service.process.ProcessFactory;
import com.phillippitts.audio2video.service.process.ProcessTerminator;
import com.phillippitts.audio2video.service.process.StreamGobbler;
import com.phillippitts.audio2video.util.ProcessTimeouts;
import com.phillippitts.audio2video.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link ConversionExecutor} that drives a local ffmpeg process.
 *
 * <p><b>Process lifecycle:</b>
 * <ol>
 *   <li>Spawn ffmpeg (no shell) with the fixed invocation from {@link EncoderCommandBuilder}</li>
 *   <li>Drain stdout through a {@link ProgressParser} and stderr into the job's {@link LogTail},
 *       each on its own daemon reader</li>
 *   <li>Poll for exit, checking for cancellation between polls</li>
 *   <li>On cancellation: terminate, wait the grace period, force-kill</li>
 *   <li>Classify the exit and delete the output file unless the encode succeeded</li>
 * </ol>
 *
 * <p>Outcome rules: exit 0 with the output present succeeds; a non-zero exit fails with the
 * diagnostic tail; exit 0 without output, or a stdout read failure, also fails.
 */
@Component
public class FfmpegConversionExecutor implements ConversionExecutor {

    private static final Logger LOG = LogManager.getLogger(FfmpegConversionExecutor.class);

    private final ProcessFactory processFactory;
    private final Supplier<Path> ffmpegBinary;
    private final Duration cancelGracePeriod;

    @Autowired
    public FfmpegConversionExecutor(EncoderBinaryLocator binaries, ConversionProperties properties) {
        this(new DefaultProcessFactory(), binaries::ffmpeg,
                Duration.ofMillis(properties.getCancelGracePeriodMs()));
    }

    FfmpegConversionExecutor(ProcessFactory processFactory, Supplier<Path> ffmpegBinary, Duration cancelGracePeriod) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.ffmpegBinary = Objects.requireNonNull(ffmpegBinary, "ffmpegBinary");
        this.cancelGracePeriod = Objects.requireNonNull(cancelGracePeriod, "cancelGracePeriod");
    }

    @Override
    public EncodeHandle start(EncodeSpec spec, Consumer<ProgressSnapshot> listener, LogTail logTail) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(logTail, "logTail");

        List<String> command = EncoderCommandBuilder.build(ffmpegBinary.get().toString(), spec);
        LOG.debug("Starting encoder: {}", String.join(" ", command));

        long startNanos = System.nanoTime();
        Process process;
        try {
            // inherit our working directory so relative inputs resolve the same way
            process = processFactory.start(command, null);
        } catch (IOException e) {
            throw ConversionExceptionBuilder.create(ConversionErrorKind.LAUNCH_FAILED,
                            "Failed to start encoder: " + e.getMessage())
                    .cause(e)
                    .metadata("binary", command.get(0))
                    .build();
        }

        String shortId = spec.jobId().toString().substring(0, 8);
        ProgressParser parser = new ProgressParser();
        StreamGobbler stdout = StreamGobbler.start(process.getInputStream(), "ffmpeg-progress-" + shortId,
                line -> parser.accept(line).ifPresent(snapshot -> deliver(listener, snapshot)));
        StreamGobbler stderr = StreamGobbler.start(process.getErrorStream(), "ffmpeg-stderr-" + shortId,
                line -> {
                    logTail.append(line);
                    LOG.debug("[ffmpeg {}] {}", shortId, line);
                });
        return new RunningEncode(spec, process, parser, stdout, stderr, logTail, startNanos);
    }

    private static void deliver(Consumer<ProgressSnapshot> listener, ProgressSnapshot snapshot) {
        try {
            listener.accept(snapshot);
        } catch (RuntimeException e) {
            // keep draining stdout, a stalled pipe would block the encoder
            LOG.warn("Progress listener failed: {}", e.toString());
        }
    }

    private final class RunningEncode implements EncodeHandle {

        private final EncodeSpec spec;
        private final Process process;
        private final ProgressParser parser;
        private final StreamGobbler stdout;
        private final StreamGobbler stderr;
        private final LogTail logTail;
        private final long startNanos;
        private volatile boolean cancelRequested;
        private volatile EncodeOutcome outcome;

        RunningEncode(EncodeSpec spec, Process process, ProgressParser parser, StreamGobbler stdout,
                      StreamGobbler stderr, LogTail logTail, long startNanos) {
            this.spec = spec;
            this.process = process;
            this.parser = parser;
            this.stdout = stdout;
            this.stderr = stderr;
            this.logTail = logTail;
            this.startNanos = startNanos;
        }

        @Override
        public void cancel() {
            if (!cancelRequested) {
                cancelRequested = true;
                LOG.debug("Cancellation requested for {}", spec.output().getFileName());
            }
        }

        @Override
        public boolean isCancelRequested() {
            return cancelRequested;
        }

        @Override
        public synchronized EncodeOutcome await() {
            if (outcome == null) {
                outcome = supervise();
            }
            return outcome;
        }

        private EncodeOutcome supervise() {
            while (true) {
                if (cancelRequested) {
                    return terminateAsCancelled();
                }
                try {
                    if (process.waitFor(ProcessTimeouts.SUPERVISION_POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
                        break;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Interrupted while supervising encoder; terminating");
                    return terminateAsCancelled();
                }
            }

            int exitCode = process.exitValue();
            boolean stdoutDrained = stdout.join(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            stderr.join(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            long elapsed = TimeUtils.elapsedMillis(startNanos);

            if (exitCode != 0) {
                return fail(ConversionExceptionBuilder.create(ConversionErrorKind.ENCODER_EXITED_NON_ZERO,
                                "Encoder exited with code " + exitCode)
                        .exitCode(exitCode)
                        .durationMs(elapsed)
                        .logTail(logTail.lines())
                        .build(), elapsed);
            }

            Optional<IOException> readFailure = stdout.failure();
            if (readFailure.isPresent() || !stdoutDrained) {
                ConversionExceptionBuilder builder = ConversionExceptionBuilder.create(
                                ConversionErrorKind.ENCODER_IO_FAILURE,
                                readFailure.isPresent() ? "Reading encoder progress failed"
                                        : "Encoder progress stream did not close")
                        .exitCode(exitCode)
                        .durationMs(elapsed)
                        .logTail(logTail.lines());
                readFailure.ifPresent(builder::cause);
                return fail(builder.build(), elapsed);
            }

            if (!Files.isRegularFile(spec.output())) {
                return fail(ConversionExceptionBuilder.create(ConversionErrorKind.OUTPUT_MISSING,
                                "Encoder finished but produced no output file")
                        .exitCode(exitCode)
                        .durationMs(elapsed)
                        .logTail(logTail.lines())
                        .metadata("output", spec.output().getFileName())
                        .build(), elapsed);
            }

            if (!parser.hasEnded()) {
                LOG.warn("Encoder exited cleanly without a final progress frame ({} frames seen)",
                        parser.frameCount());
            }
            LOG.debug("Encoder finished in {}ms", elapsed);
            return EncodeOutcome.succeeded(elapsed);
        }

        private EncodeOutcome terminateAsCancelled() {
            boolean dead = ProcessTerminator.terminate(process, cancelGracePeriod);
            if (!dead) {
                LOG.error("Encoder process could not be killed (pid={})", safePid());
            }
            stdout.join(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            stderr.join(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            deletePartialOutput();
            long elapsed = TimeUtils.elapsedMillis(startNanos);
            LOG.debug("Encoder cancelled after {}ms", elapsed);
            return EncodeOutcome.cancelled(elapsed);
        }

        private EncodeOutcome fail(ConversionException failure, long elapsed) {
            deletePartialOutput();
            return EncodeOutcome.failed(failure, elapsed);
        }

        private void deletePartialOutput() {
            try {
                if (Files.deleteIfExists(spec.output())) {
                    LOG.debug("Deleted partial output {}", spec.output().getFileName());
                }
            } catch (IOException e) {
                LOG.warn("Could not delete partial output {}: {}", spec.output(), e.toString());
            }
        }

        private String safePid() {
            try {
                return String.valueOf(process.pid());
            } catch (UnsupportedOperationException e) {
                return "unknown";
            }
        }
    }
}
