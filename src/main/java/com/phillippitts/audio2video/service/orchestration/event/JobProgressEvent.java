package com.phillippitts.audio2video.service.orchestration.event;

import com.phillippitts.audio2video.domain.Progress;

import java.time.Instant;
import java.util.UUID;

/**
 * Published for each progress frame of a running job, in encoder order.
 *
 * @param progress effective (monotonic) progress, possibly indeterminate
 * @param elapsedMs output time reported by the encoder
 * @param speed encoder speed as written, e.g. {@code "14.2x"}; may be {@code null}
 */
public record JobProgressEvent(UUID jobId, Progress progress, long elapsedMs, String speed, Instant at) {

    public JobProgressEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
