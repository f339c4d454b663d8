package com.phillippitts.audio2video.exception;

import com.phillippitts.audio2video.domain.JobStatus;

import java.util.UUID;

/**
 * Thrown when a job is asked to move to a status its current status does not allow,
 * for example retrying a job that has not failed or been cancelled.
 */
public class IllegalJobTransitionException extends Audio2VideoException {

    private final UUID jobId;
    private final JobStatus from;

    public IllegalJobTransitionException(UUID jobId, JobStatus from, String operation) {
        super("Cannot " + operation + " job " + jobId + " in status " + from);
        this.jobId = jobId;
        this.from = from;
    }

    public UUID getJobId() {
        return jobId;
    }

    public JobStatus getFrom() {
        return from;
    }
}
