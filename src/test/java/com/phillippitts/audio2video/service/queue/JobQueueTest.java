package com.phillippitts.audio2video.service.queue;

import com.phillippitts.audio2video.domain.ConversionJob;
import com.phillippitts.audio2video.domain.JobStateMachine;
import com.phillippitts.audio2video.domain.JobStatus;
import com.phillippitts.audio2video.exception.JobBusyException;
import com.phillippitts.audio2video.exception.JobNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobQueueTest {

    private JobQueue queue;
    private JobStateMachine stateMachine;
    private ConversionJob a;
    private ConversionJob b;
    private ConversionJob c;

    @BeforeEach
    void setUp() {
        queue = new JobQueue();
        stateMachine = new JobStateMachine();
        a = ConversionJob.create(Path.of("a.mp3"));
        b = ConversionJob.create(Path.of("b.mp3"));
        c = ConversionJob.create(Path.of("c.mp3"));
        queue.append(a);
        queue.append(b);
        queue.append(c);
    }

    @Test
    void keepsInsertionOrder() {
        assertThat(queue.snapshot()).containsExactly(a, b, c);
        assertThat(queue.size()).isEqualTo(3);
    }

    @Test
    void nextQueuedSkipsJobsThatAlreadyLeftQueued() {
        stateMachine.start(a, Path.of("cover.png"));
        stateMachine.cancel(b);

        assertThat(queue.nextQueued()).contains(c);
    }

    @Test
    void nextQueuedIsEmptyWhenNothingWaits() {
        stateMachine.cancel(a);
        stateMachine.cancel(b);
        stateMachine.cancel(c);

        assertThat(queue.nextQueued()).isEmpty();
    }

    @Test
    void removeDropsNonRunningJob() {
        ConversionJob removed = queue.remove(b.getId());

        assertThat(removed).isSameAs(b);
        assertThat(queue.snapshot()).containsExactly(a, c);
    }

    @Test
    void removeRunningJobRaisesBusy() {
        stateMachine.start(a, Path.of("cover.png"));

        assertThatThrownBy(() -> queue.remove(a.getId()))
                .isInstanceOf(JobBusyException.class)
                .hasMessageContaining(a.getId().toString());
        assertThat(queue.snapshot()).contains(a);
    }

    @Test
    void removeUnknownJobRaisesNotFound() {
        assertThatThrownBy(() -> queue.remove(UUID.randomUUID()))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void clearRetainsRunningJobs() {
        stateMachine.start(b, Path.of("cover.png"));

        QueueClearResult result = queue.clear();

        assertThat(result.isPartial()).isTrue();
        assertThat(result.retainedRunning()).containsExactly(b.getId());
        assertThat(result.removed()).containsExactly(a.getId(), c.getId());
        assertThat(queue.snapshot()).containsExactly(b);
    }

    @Test
    void clearEmptiesIdleQueue() {
        QueueClearResult result = queue.clear();

        assertThat(result.isPartial()).isFalse();
        assertThat(queue.size()).isZero();
    }

    @Test
    void findAndFilterByStatus() {
        stateMachine.cancel(c);

        assertThat(queue.find(c.getId())).contains(c);
        assertThat(queue.find(UUID.randomUUID())).isEmpty();
        assertThat(queue.withStatus(JobStatus.QUEUED)).containsExactly(a, b);
        assertThat(queue.withStatus(JobStatus.CANCELLED)).containsExactly(c);
    }
}
