package com.phillippitts.audio2video.domain;

/**
 * Lifecycle status of a {@link ConversionJob}.
 *
 * <pre>
 * QUEUED → RUNNING → COMPLETED | FAILED | CANCELLED
 * QUEUED → CANCELLED | FAILED
 * </pre>
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
