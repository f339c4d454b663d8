package com.phillippitts.audio2video.exception;

import java.util.UUID;

/**
 * Thrown when an operation references a job id that is not in the queue.
 */
public class JobNotFoundException extends Audio2VideoException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("No job with id: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
