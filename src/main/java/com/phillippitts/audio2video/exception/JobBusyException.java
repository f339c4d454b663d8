package com.phillippitts.audio2video.exception;

import java.util.UUID;

/**
 * Thrown when a queue mutation targets a job that is currently running.
 * Running jobs can only be cancelled, never removed.
 */
public class JobBusyException extends Audio2VideoException {

    private final UUID jobId;

    public JobBusyException(UUID jobId) {
        super("Job is running and cannot be removed: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
