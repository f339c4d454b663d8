package com.phillippitts.audio2video.service.process;

import com.phillippitts.audio2video.util.ProcessTimeouts;
import com.phillippitts.audio2video.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs a short-lived helper process to completion with a hard timeout, capturing both streams.
 *
 * <p>Used for the duration probe and the encoder's inspection fallback. Output is capped so a
 * misbehaving tool cannot exhaust memory; once the cap is hit the stream is still drained.
 */
public final class BoundedProcessRunner {

    private static final Logger LOG = LogManager.getLogger(BoundedProcessRunner.class);

    /** Probe output is tiny; this cap only guards against pathological tools. */
    static final int MAX_CAPTURE_CHARS = 64 * 1024;

    private final ProcessFactory processFactory;

    public BoundedProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Executes {@code command} and waits for it, killing it after {@code timeout}.
     *
     * @param command argument vector, executable first
     * @param timeout maximum run time
     * @return result with exit code and captured output
     * @throws IOException if the process cannot be started
     * @throws InterruptedIOException if the calling thread is interrupted while waiting
     */
    public ProcessResult run(List<String> command, Duration timeout) throws IOException {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        long start = System.nanoTime();

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = processFactory.start(command, null);
        String tool = command.isEmpty() ? "process" : command.get(0);

        // Start gobblers before waiting to avoid deadlock
        StreamGobbler out = StreamGobbler.start(process.getInputStream(), "probe-out", cappedSink(stdout));
        StreamGobbler err = StreamGobbler.start(process.getErrorStream(), "probe-err", cappedSink(stderr));

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOG.warn("{} did not finish within {}ms; terminating", tool, timeout.toMillis());
                ProcessTerminator.terminate(process, ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT);
                out.join(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                err.join(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                return new ProcessResult(-1, snapshot(stdout), snapshot(stderr), true, TimeUtils.elapsedMillis(start));
            }
            out.join(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            err.join(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            int exitCode = process.exitValue();
            long durationMs = TimeUtils.elapsedMillis(start);
            LOG.debug("{} exited with {} in {}ms", tool, exitCode, durationMs);
            return new ProcessResult(exitCode, snapshot(stdout), snapshot(stderr), false, durationMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessTerminator.terminate(process, ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT);
            InterruptedIOException ex = new InterruptedIOException("Interrupted while waiting for " + tool);
            ex.initCause(e);
            throw ex;
        }
    }

    private static Consumer<String> cappedSink(StringBuilder sink) {
        return line -> {
            synchronized (sink) {
                if (sink.length() >= MAX_CAPTURE_CHARS) {
                    return;
                }
                if (sink.length() > 0) {
                    sink.append('\n');
                }
                int available = MAX_CAPTURE_CHARS - sink.length();
                sink.append(line, 0, Math.min(line.length(), available));
            }
        };
    }

    private static String snapshot(StringBuilder sb) {
        synchronized (sb) {
            return sb.toString();
        }
    }
}
