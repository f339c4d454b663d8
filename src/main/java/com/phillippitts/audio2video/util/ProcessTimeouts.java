package com.phillippitts.audio2video.util;

import java.time.Duration;

/**
 * Standard timeout values for process and thread management.
 *
 * <p>Used by {@link com.phillippitts.audio2video.service.process.BoundedProcessRunner},
 * {@link com.phillippitts.audio2video.service.process.ProcessTerminator} and
 * {@link com.phillippitts.audio2video.service.encoder.FfmpegConversionExecutor}.
 * The cancellation grace period itself is configurable ({@code conversion.cancel-grace-period-ms}).
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream reader threads to flush buffered output after process exit.
     *
     * <p>The encoder writes its final progress frame and summary right before exiting, so
     * this is more generous than a plain drain.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(2000);

    /**
     * Timeout for stream reader threads during cleanup (best-effort).
     *
     * <p>Readers are daemon threads; once the process is dead their streams hit EOF.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(200);

    /**
     * Timeout for graceful shutdown of short-lived helper processes (probe, inspection).
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful termination via {@link Process#destroyForcibly()}.
     *
     * <p>1000ms is the OS-level deadline for SIGKILL (Unix) or TerminateProcess (Windows).
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Interval at which a supervising thread re-checks for cancellation while the encoder runs.
     */
    public static final Duration SUPERVISION_POLL_INTERVAL = Duration.ofMillis(100);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
