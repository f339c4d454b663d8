package com.phillippitts.audio2video.domain;

import com.phillippitts.audio2video.exception.ConversionErrorKind;
import com.phillippitts.audio2video.exception.IllegalJobTransitionException;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for the lifecycle of a {@link ConversionJob}.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * QUEUED  → RUNNING   (dequeued by the controller)
 * RUNNING → COMPLETED (encoder succeeded)
 * RUNNING → FAILED    (encoder failed, or preparation failed before spawn)
 * RUNNING → CANCELLED (encoder cancelled)
 * QUEUED  → CANCELLED (cancelled before it ever started)
 * QUEUED  → FAILED    (queue halted by a fatal launch error)
 * </pre>
 *
 * <p>Terminal states have no outgoing transitions. {@link #retry(ConversionJob)} does not
 * transition the old record; it creates a new Queued one for the same input.
 *
 * <p><b>Thread Safety:</b> transitions are applied under a single {@link ReentrantLock},
 * so a cancel racing with a completion resolves to exactly one terminal status.
 *
 * @since 1.0
 */
public final class JobStateMachine {

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS = buildTransitions();

    private final Lock lock = new ReentrantLock();

    private static Map<JobStatus, Set<JobStatus>> buildTransitions() {
        Map<JobStatus, Set<JobStatus>> t = new EnumMap<>(JobStatus.class);
        t.put(JobStatus.QUEUED, EnumSet.of(JobStatus.RUNNING, JobStatus.CANCELLED, JobStatus.FAILED));
        t.put(JobStatus.RUNNING, EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED));
        t.put(JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class));
        t.put(JobStatus.FAILED, EnumSet.noneOf(JobStatus.class));
        t.put(JobStatus.CANCELLED, EnumSet.noneOf(JobStatus.class));
        return Collections.unmodifiableMap(t);
    }

    /**
     * Checks whether the transition table permits {@code from → to}.
     *
     * @param from current status
     * @param to requested status
     * @return {@code true} if allowed
     */
    public static boolean isAllowed(JobStatus from, JobStatus to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * Moves a Queued job to Running and snapshots the cover image it will use.
     *
     * @param job job to start
     * @param coverSnapshot cover image in effect right now
     * @return {@code true} if started, {@code false} if the job was no longer Queued
     */
    public boolean start(ConversionJob job, Path coverSnapshot) {
        return transition(job, JobStatus.RUNNING, () -> job.markStarted(coverSnapshot));
    }

    /**
     * Marks a Running job Completed with progress 1.0.
     *
     * @return {@code true} if applied
     */
    public boolean complete(ConversionJob job) {
        return transition(job, JobStatus.COMPLETED, job::markCompleted);
    }

    /**
     * Marks a Running (or, for queue-fatal errors, Queued) job Failed.
     *
     * @param job job that failed
     * @param kind error classification
     * @param message short human-readable cause
     * @return {@code true} if applied
     */
    public boolean fail(ConversionJob job, ConversionErrorKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        return transition(job, JobStatus.FAILED, () -> job.markFailed(kind, message));
    }

    /**
     * Marks a Queued or Running job Cancelled.
     *
     * @return {@code true} if applied, {@code false} if the job was already terminal
     */
    public boolean cancel(ConversionJob job) {
        return transition(job, JobStatus.CANCELLED, job::markCancelled);
    }

    /**
     * Marks a job Cancelled only if it is still Queued. Used where a worker may be claiming
     * the job concurrently and a Running job needs its encoder stopped instead.
     *
     * @return {@code true} if applied, {@code false} if the job had left Queued
     */
    public boolean cancelQueued(ConversionJob job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            if (job.getStatus() != JobStatus.QUEUED) {
                return false;
            }
            job.markCancelled();
            job.setStatus(JobStatus.CANCELLED);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates a fresh Queued record for a Failed or Cancelled job.
     *
     * @param job the finished job; left unchanged
     * @return new job with the same input path, reset progress and no error
     * @throws IllegalJobTransitionException if the job is not Failed or Cancelled
     */
    public ConversionJob retry(ConversionJob job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            JobStatus current = job.getStatus();
            if (current != JobStatus.FAILED && current != JobStatus.CANCELLED) {
                throw new IllegalJobTransitionException(job.getId(), current, "retry");
            }
            return job.copyForRetry();
        } finally {
            lock.unlock();
        }
    }

    private boolean transition(ConversionJob job, JobStatus target, Runnable onTransition) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            if (!isAllowed(job.getStatus(), target)) {
                return false;
            }
            onTransition.run();
            job.setStatus(target);
            return true;
        } finally {
            lock.unlock();
        }
    }
}
