package com.phillippitts.audio2video.service.encoder;

import com.phillippitts.audio2video.domain.LogTail;

import java.util.function.Consumer;

/**
 * Runs one encode as an external process.
 *
 * <p>Implementations spawn the encoder, feed every progress frame to {@code listener} in
 * stream order, keep the most recent diagnostic lines in {@code logTail}, and delete the
 * partial output on any outcome other than success.
 */
public interface ConversionExecutor {

    /**
     * Spawns the encoder and returns immediately.
     *
     * @param spec paths and duration of the encode
     * @param listener receives progress snapshots on the stdout reader thread
     * @param logTail receives encoder diagnostic lines
     * @return handle used to await or cancel the encode
     * @throws com.phillippitts.audio2video.exception.ConversionException with kind
     *         {@code LAUNCH_FAILED} when the process cannot be started
     */
    EncodeHandle start(EncodeSpec spec, Consumer<ProgressSnapshot> listener, LogTail logTail);
}
