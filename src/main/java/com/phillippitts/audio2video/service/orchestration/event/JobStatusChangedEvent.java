package com.phillippitts.audio2video.service.orchestration.event;

import com.phillippitts.audio2video.domain.JobStatus;
import com.phillippitts.audio2video.exception.ConversionErrorKind;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published on every job status transition.
 *
 * @param jobId job that changed
 * @param status new status
 * @param outputPath destination file, when already assigned
 * @param errorKind failure classification; {@code null} unless {@code status} is FAILED
 * @param errorMessage short cause; {@code null} unless {@code status} is FAILED
 * @param logTail encoder diagnostic tail; empty unless {@code status} is FAILED
 * @param at when the transition happened
 */
public record JobStatusChangedEvent(
        UUID jobId,
        JobStatus status,
        Path outputPath,
        ConversionErrorKind errorKind,
        String errorMessage,
        List<String> logTail,
        Instant at
) {
    public JobStatusChangedEvent {
        logTail = logTail == null ? List.of() : List.copyOf(logTail);
        if (at == null) {
            at = Instant.now();
        }
    }
}
