package com.phillippitts.audio2video.service.encoder;

/**
 * Control handle of a running encode.
 */
public interface EncodeHandle {

    /**
     * Blocks until the encode reaches a terminal outcome. Subsequent calls return the same
     * outcome.
     */
    EncodeOutcome await();

    /**
     * Requests cancellation without blocking. The thread in {@link #await()} performs the
     * termination and reports {@link EncodeOutcome.Status#CANCELLED}. Idempotent.
     */
    void cancel();

    boolean isCancelRequested();
}
