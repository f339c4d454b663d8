package com.phillippitts.audio2video.service.events;

import com.phillippitts.audio2video.service.orchestration.event.JobStatusChangedEvent;
import com.phillippitts.audio2video.service.orchestration.event.JobSubmittedEvent;
import com.phillippitts.audio2video.service.orchestration.event.QueueDrainedEvent;
import com.phillippitts.audio2video.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Logs job lifecycle events succinctly. Progress events are not logged. */
@Component
class ConversionEventsListener {
    private static final Logger LOG = LogManager.getLogger(ConversionEventsListener.class);

    private static final int MAX_ERROR_CHARS = 200;

    @EventListener
    void onSubmitted(JobSubmittedEvent e) {
        LOG.debug("Job submitted: id={}, audio={}, retryOf={}",
                e.jobId(), e.inputAudioPath().getFileName(), e.retryOf());
    }

    @EventListener
    void onStatusChanged(JobStatusChangedEvent e) {
        switch (e.status()) {
            case FAILED -> LOG.warn("Job {} failed: kind={}, cause={}", e.jobId(), e.errorKind(),
                    LogSanitizer.singleLine(e.errorMessage(), MAX_ERROR_CHARS));
            case COMPLETED -> LOG.info("Job {} completed: {}", e.jobId(), e.outputPath());
            default -> LOG.info("Job {} -> {}", e.jobId(), e.status());
        }
    }

    @EventListener
    void onDrained(QueueDrainedEvent e) {
        if (e.halted()) {
            LOG.error("Conversion queue halted: {} completed, {} failed, {} cancelled",
                    e.completed(), e.failed(), e.cancelled());
        } else {
            LOG.info("Conversion queue drained: {} completed, {} failed, {} cancelled",
                    e.completed(), e.failed(), e.cancelled());
        }
    }
}
