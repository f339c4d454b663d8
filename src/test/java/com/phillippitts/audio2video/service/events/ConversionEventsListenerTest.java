package com.phillippitts.audio2video.service.events;

import com.phillippitts.audio2video.domain.JobStatus;
import com.phillippitts.audio2video.exception.ConversionErrorKind;
import com.phillippitts.audio2video.service.orchestration.event.JobStatusChangedEvent;
import com.phillippitts.audio2video.service.orchestration.event.JobSubmittedEvent;
import com.phillippitts.audio2video.service.orchestration.event.QueueDrainedEvent;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;

class ConversionEventsListenerTest {

    private final ConversionEventsListener listener = new ConversionEventsListener();

    @Test
    void handlersDoNotThrow() {
        UUID id = UUID.randomUUID();

        assertThatCode(() -> {
            listener.onSubmitted(new JobSubmittedEvent(id, Path.of("a.mp3"), null, null));
            listener.onStatusChanged(new JobStatusChangedEvent(id, JobStatus.RUNNING, null, null, null,
                    List.of(), null));
            listener.onStatusChanged(new JobStatusChangedEvent(id, JobStatus.COMPLETED, Path.of("a.mpg"),
                    null, null, List.of(), null));
            listener.onDrained(new QueueDrainedEvent(1, 0, 0, false, null));
        }).doesNotThrowAnyException();
    }

    @Test
    void failureWithMissingMessageIsLogged() {
        UUID id = UUID.randomUUID();

        assertThatCode(() -> {
            listener.onStatusChanged(new JobStatusChangedEvent(id, JobStatus.FAILED, null,
                    ConversionErrorKind.LAUNCH_FAILED, null, List.of("line"), null));
            listener.onDrained(new QueueDrainedEvent(0, 3, 0, true, null));
        }).doesNotThrowAnyException();
    }
}
