package com.phillippitts.audio2video.domain;

import java.util.OptionalLong;

/**
 * Job progress: either a fraction in [0.0, 1.0] or the indeterminate sentinel used when
 * the audio duration is unknown.
 *
 * @param fraction completed fraction; always 0.0 when {@code determinate} is false
 * @param determinate whether {@code fraction} carries meaning
 */
public record Progress(double fraction, boolean determinate) {

    private static final Progress INDETERMINATE = new Progress(0.0, false);
    private static final Progress ZERO = new Progress(0.0, true);
    private static final Progress COMPLETE = new Progress(1.0, true);

    public Progress {
        if (Double.isNaN(fraction) || fraction < 0.0 || fraction > 1.0) {
            throw new IllegalArgumentException("fraction must be within [0,1]: " + fraction);
        }
        if (!determinate && fraction != 0.0) {
            throw new IllegalArgumentException("indeterminate progress has no fraction");
        }
    }

    public static Progress indeterminate() {
        return INDETERMINATE;
    }

    public static Progress zero() {
        return ZERO;
    }

    public static Progress complete() {
        return COMPLETE;
    }

    /**
     * Clamps the given value into [0,1].
     */
    public static Progress of(double fraction) {
        if (Double.isNaN(fraction)) {
            return ZERO;
        }
        return new Progress(Math.max(0.0, Math.min(1.0, fraction)), true);
    }

    /**
     * Computes {@code clamp(elapsedMs / durationMs, 0, 1)}, or indeterminate when the duration
     * is unknown or not positive.
     *
     * @param elapsedMs elapsed output time reported by the encoder
     * @param durationMs total audio duration, if resolved
     * @return progress value
     */
    public static Progress fromElapsed(long elapsedMs, OptionalLong durationMs) {
        if (durationMs == null || durationMs.isEmpty() || durationMs.getAsLong() <= 0) {
            return INDETERMINATE;
        }
        return of((double) elapsedMs / durationMs.getAsLong());
    }

    /**
     * Starting progress for a job whose duration is (or is not) known.
     */
    public static Progress initial(OptionalLong durationMs) {
        return durationMs != null && durationMs.isPresent() && durationMs.getAsLong() > 0 ? ZERO : INDETERMINATE;
    }

    public boolean isIndeterminate() {
        return !determinate;
    }

    @Override
    public String toString() {
        return determinate ? String.format("%.1f%%", fraction * 100.0) : "indeterminate";
    }
}
