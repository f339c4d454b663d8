package com.phillippitts.audio2video.service.queue;

import java.util.List;
import java.util.UUID;

/**
 * Result of {@link JobQueue#clear()}.
 *
 * @param removed ids of the jobs taken out of the queue
 * @param retainedRunning ids of the Running jobs left in place
 */
public record QueueClearResult(List<UUID> removed, List<UUID> retainedRunning) {

    public QueueClearResult {
        removed = List.copyOf(removed);
        retainedRunning = List.copyOf(retainedRunning);
    }

    /**
     * {@code true} when Running jobs kept the queue from being emptied.
     */
    public boolean isPartial() {
        return !retainedRunning.isEmpty();
    }
}
