package com.phillippitts.audio2video.exception;

/**
 * Classification of conversion errors.
 *
 * <p>The kind decides how far a failure propagates: job-level kinds are recorded on the
 * failing job and the queue keeps draining, queue-fatal kinds halt the controller and fail
 * every job still waiting.
 */
public enum ConversionErrorKind {

    /** Audio or cover file absent at schedule time. */
    INPUT_MISSING("Input file missing", false),

    /** Duration could not be resolved; the job degrades to indeterminate progress. */
    PROBE_FAILED("Duration probe failed", false),

    /** Encoder executable missing or could not be spawned. */
    LAUNCH_FAILED("Encoder could not be launched", true),

    /** Encoder ran and exited with a non-zero status. */
    ENCODER_EXITED_NON_ZERO("Encoder exited with an error", false),

    /** Encoder exited cleanly but left no output file behind. */
    OUTPUT_MISSING("Output file was not created", false),

    /** Reading the encoder streams or waiting for it failed. */
    ENCODER_IO_FAILURE("Encoder I/O failure", false),

    /** No free output name could be found. */
    NAMING_COLLISION_EXHAUSTED("No free output file name", false);

    private final String summary;
    private final boolean queueFatal;

    ConversionErrorKind(String summary, boolean queueFatal) {
        this.summary = summary;
        this.queueFatal = queueFatal;
    }

    /**
     * Short human-readable cause suitable for a status column.
     *
     * @return summary text
     */
    public String summary() {
        return summary;
    }

    /**
     * Whether this error makes every remaining job pointless to run.
     *
     * @return {@code true} when the controller must halt
     */
    public boolean isQueueFatal() {
        return queueFatal;
    }
}
