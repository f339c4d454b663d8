package com.phillippitts.audio2video.service.orchestration.event;

import java.time.Instant;

/**
 * Published when the controller stops because no Queued job remains (or the queue halted).
 *
 * @param halted {@code true} when a queue-fatal error stopped the run
 */
public record QueueDrainedEvent(int completed, int failed, int cancelled, boolean halted, Instant at) {

    public QueueDrainedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }

    public int total() {
        return completed + failed + cancelled;
    }
}
