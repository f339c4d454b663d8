package com.phillippitts.audio2video.domain;

import com.phillippitts.audio2video.exception.ConversionErrorKind;
import com.phillippitts.audio2video.exception.IllegalJobTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStateMachineTest {

    private static final Path COVER = Path.of("cover.png");

    private JobStateMachine stateMachine;
    private ConversionJob job;

    @BeforeEach
    void setUp() {
        stateMachine = new JobStateMachine();
        job = ConversionJob.create(Path.of("track.mp3"));
    }

    @Test
    void queuedJobStartsAndSnapshotsCover() {
        assertThat(stateMachine.start(job, COVER)).isTrue();

        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getCoverImagePath()).isEqualTo(COVER.toAbsolutePath().normalize());
        assertThat(job.getStartedAt()).isPresent();
    }

    @Test
    void completeSetsFullProgress() {
        stateMachine.start(job, COVER);

        assertThat(stateMachine.complete(job)).isTrue();

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(Progress.complete());
        assertThat(job.getFinishedAt()).isPresent();
    }

    @Test
    void failRecordsKindAndMessage() {
        stateMachine.start(job, COVER);

        assertThat(stateMachine.fail(job, ConversionErrorKind.ENCODER_EXITED_NON_ZERO, "exit 1")).isTrue();

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorKind()).contains(ConversionErrorKind.ENCODER_EXITED_NON_ZERO);
        assertThat(job.getErrorMessage()).contains("exit 1");
    }

    @Test
    void queuedJobCancelsDirectly() {
        assertThat(stateMachine.cancel(job)).isTrue();

        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getStartedAt()).isEmpty();
        assertThat(job.getErrorMessage()).isEmpty();
    }

    @Test
    void cancelQueuedLeavesRunningJobAlone() {
        ConversionJob other = ConversionJob.create(Path.of("other.mp3"));
        stateMachine.start(job, COVER);

        assertThat(stateMachine.cancelQueued(job)).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(stateMachine.cancelQueued(other)).isTrue();
        assertThat(other.getStatus()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void queuedJobCanFailWhenQueueHalts() {
        assertThat(stateMachine.fail(job, ConversionErrorKind.LAUNCH_FAILED, "no encoder")).isTrue();

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void queuedJobCannotComplete() {
        assertThat(stateMachine.complete(job)).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void terminalStatesHaveNoOutgoingTransitions(JobStatus terminal) {
        for (JobStatus target : JobStatus.values()) {
            assertThat(JobStateMachine.isAllowed(terminal, target))
                    .as("%s -> %s", terminal, target)
                    .isFalse();
        }
    }

    @Test
    void finishedJobIgnoresFurtherTransitions() {
        stateMachine.start(job, COVER);
        stateMachine.complete(job);

        assertThat(stateMachine.cancel(job)).isFalse();
        assertThat(stateMachine.fail(job, ConversionErrorKind.ENCODER_IO_FAILURE, "late")).isFalse();
        assertThat(stateMachine.start(job, COVER)).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getErrorMessage()).isEmpty();
    }

    @Test
    void retryCreatesFreshRecordAndLeavesOriginalUnchanged() {
        stateMachine.start(job, COVER);
        job.assignDuration(OptionalLong.of(10_000));
        job.advanceProgress(Progress.of(0.4));
        stateMachine.fail(job, ConversionErrorKind.ENCODER_EXITED_NON_ZERO, "boom");

        ConversionJob fresh = stateMachine.retry(job);

        assertThat(fresh.getId()).isNotEqualTo(job.getId());
        assertThat(fresh.getInputAudioPath()).isEqualTo(job.getInputAudioPath());
        assertThat(fresh.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(fresh.getProgress()).isEqualTo(Progress.zero());
        assertThat(fresh.getErrorMessage()).isEmpty();
        assertThat(fresh.getRetryOf()).contains(job.getId());
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).contains("boom");
        assertThat(job.getProgress().fraction()).isEqualTo(0.4);
    }

    @Test
    void retryOfCancelledJobIsAllowed() {
        stateMachine.cancel(job);

        assertThat(stateMachine.retry(job).getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"QUEUED", "RUNNING", "COMPLETED"})
    void retryRejectedUnlessFailedOrCancelled(JobStatus status) {
        if (status != JobStatus.QUEUED) {
            stateMachine.start(job, COVER);
        }
        if (status == JobStatus.COMPLETED) {
            stateMachine.complete(job);
        }

        assertThatThrownBy(() -> stateMachine.retry(job))
                .isInstanceOf(IllegalJobTransitionException.class)
                .satisfies(e -> assertThat(((IllegalJobTransitionException) e).getFrom()).isEqualTo(status));
    }

    @Test
    void racingCancelAndCompleteResolveToOneTerminalStatus() throws Exception {
        for (int round = 0; round < 200; round++) {
            ConversionJob racer = ConversionJob.create(Path.of("race.mp3"));
            stateMachine.start(racer, COVER);
            CountDownLatch go = new CountDownLatch(1);
            AtomicInteger applied = new AtomicInteger();
            List<Thread> threads = new ArrayList<>();
            threads.add(new Thread(() -> {
                await(go);
                if (stateMachine.complete(racer)) {
                    applied.incrementAndGet();
                }
            }));
            threads.add(new Thread(() -> {
                await(go);
                if (stateMachine.cancel(racer)) {
                    applied.incrementAndGet();
                }
            }));
            threads.forEach(Thread::start);
            go.countDown();
            for (Thread t : threads) {
                t.join(2000);
            }

            assertThat(applied.get()).isEqualTo(1);
            assertThat(racer.getStatus().isTerminal()).isTrue();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
