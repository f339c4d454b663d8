package com.phillippitts.audio2video.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads a process stream line by line on a daemon thread and hands each line to a sink.
 *
 * <p>Both process streams must be drained concurrently, otherwise a full pipe buffer blocks
 * the child. A read failure ends the gobbler and is kept for the supervisor to inspect.
 */
public final class StreamGobbler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StreamGobbler.class);

    private final InputStream inputStream;
    private final Consumer<String> sink;
    private final String name;
    private volatile IOException failure;
    private Thread thread;

    private StreamGobbler(InputStream inputStream, Consumer<String> sink, String name) {
        this.inputStream = inputStream;
        this.sink = sink;
        this.name = name;
    }

    /**
     * Starts a daemon thread draining {@code inputStream} into {@code sink}.
     *
     * @param inputStream process stream to drain
     * @param name thread name, used in logs
     * @param sink receives every line, without line terminator
     * @return the running gobbler
     */
    public static StreamGobbler start(InputStream inputStream, String name, Consumer<String> sink) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name);
        Thread t = new Thread(gobbler, name);
        t.setDaemon(true);
        gobbler.thread = t;
        t.start();
        return gobbler;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                sink.accept(line);
            }
        } catch (IOException e) {
            failure = e;
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        } catch (RuntimeException e) {
            LOG.warn("Stream gobbler '{}' sink failed: {}", name, e.toString());
            throw e;
        }
    }

    /**
     * Waits up to {@code timeout} for the stream to reach EOF.
     *
     * @return {@code true} if the gobbler finished
     */
    public boolean join(Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    /**
     * I/O error that ended the read early, if any.
     */
    public Optional<IOException> failure() {
        return Optional.ofNullable(failure);
    }
}
