package com.phillippitts.audio2video.exception;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when a single conversion cannot proceed or the encoder fails.
 *
 * <p>Carries the {@link ConversionErrorKind} used by the controller to decide whether the
 * failure stays on the job or halts the whole queue, and the diagnostic tail captured from
 * the encoder's error stream (may be empty).
 */
public class ConversionException extends Audio2VideoException {

    private final ConversionErrorKind kind;
    private final Integer exitCode;
    private final List<String> logTail;

    public ConversionException(ConversionErrorKind kind, String message) {
        this(kind, message, null, List.of(), null);
    }

    public ConversionException(ConversionErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, List.of(), cause);
    }

    public ConversionException(ConversionErrorKind kind, String message, Integer exitCode,
                               List<String> logTail, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.exitCode = exitCode;
        this.logTail = logTail == null ? List.of() : List.copyOf(logTail);
    }

    public ConversionErrorKind getKind() {
        return kind;
    }

    /**
     * Encoder exit code, or {@code null} when the failure happened before or without an exit.
     */
    public Integer getExitCode() {
        return exitCode;
    }

    public List<String> getLogTail() {
        return logTail;
    }
}
