package com.phillippitts.audio2video.service.orchestration.event;

import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a job enters the queue, including retries.
 *
 * @param retryOf id of the job being retried, or {@code null}
 */
public record JobSubmittedEvent(UUID jobId, Path inputAudioPath, UUID retryOf, Instant at) {

    public JobSubmittedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
