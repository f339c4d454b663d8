package com.phillippitts.audio2video.service.encoder;

import com.phillippitts.audio2video.domain.Progress;

import java.util.Map;
import java.util.OptionalLong;

/**
 * One frame of the encoder's progress stream.
 *
 * <p>Numeric fields the encoder did not report (or reported as {@code N/A}) are {@code -1};
 * {@code speed} is {@code null} when absent.
 *
 * @param outTimeMs elapsed output time in milliseconds, never negative
 * @param frame frames written so far
 * @param fps current encoding rate in frames per second
 * @param speed encoding speed relative to real time, as written (e.g. {@code "12.3x"})
 * @param totalSizeBytes bytes written to the output so far
 * @param ended {@code true} for the final frame ({@code progress=end})
 * @param fields every key/value pair of the frame, in arrival order
 */
public record ProgressSnapshot(long outTimeMs,
                               long frame,
                               double fps,
                               String speed,
                               long totalSizeBytes,
                               boolean ended,
                               Map<String, String> fields) {

    public ProgressSnapshot {
        if (outTimeMs < 0) {
            throw new IllegalArgumentException("outTimeMs must be >= 0");
        }
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    /**
     * Converts the elapsed time into a progress reading for a job of the given duration.
     */
    public Progress toProgress(OptionalLong durationMs) {
        return Progress.fromElapsed(outTimeMs, durationMs);
    }
}
