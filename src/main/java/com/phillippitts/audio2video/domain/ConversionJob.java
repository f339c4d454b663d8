package com.phillippitts.audio2video.domain;

import com.phillippitts.audio2video.exception.ConversionErrorKind;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One audio-to-video conversion request.
 *
 * <p>Identity and input path are fixed at creation. Status changes go through
 * {@link JobStateMachine}; everything else (cover snapshot, output path, duration, progress)
 * is assigned by the controller while the job runs.
 *
 * <p><b>Thread Safety:</b> fields are published through volatile writes; progress updates
 * are serialized on an internal lock so the monotonic check and the write are atomic.
 */
public final class ConversionJob {

    public static final int DEFAULT_LOG_TAIL_LINES = 20;

    private final UUID id;
    private final Path inputAudioPath;
    private final Instant createdAt;
    private final UUID retryOf;
    private final LogTail logTail;
    private final Lock progressLock = new ReentrantLock();

    private volatile JobStatus status = JobStatus.QUEUED;
    private volatile Path coverImagePath;
    private volatile Path outputPath;
    private volatile Long durationMs;
    private volatile Progress progress = Progress.zero();
    private volatile ConversionErrorKind errorKind;
    private volatile String errorMessage;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    private ConversionJob(Path inputAudioPath, UUID retryOf, int logTailLines) {
        Objects.requireNonNull(inputAudioPath, "inputAudioPath must not be null");
        this.id = UUID.randomUUID();
        this.inputAudioPath = inputAudioPath.toAbsolutePath().normalize();
        this.createdAt = Instant.now();
        this.retryOf = retryOf;
        this.logTail = new LogTail(logTailLines);
    }

    /**
     * Creates a new Queued job for the given audio file.
     *
     * @param inputAudioPath source audio (made absolute)
     * @param logTailLines capacity of the diagnostic ring buffer
     * @return new job
     */
    public static ConversionJob create(Path inputAudioPath, int logTailLines) {
        return new ConversionJob(inputAudioPath, null, logTailLines);
    }

    public static ConversionJob create(Path inputAudioPath) {
        return create(inputAudioPath, DEFAULT_LOG_TAIL_LINES);
    }

    /** Fresh Queued record for the same input; used by retry. */
    ConversionJob copyForRetry() {
        return new ConversionJob(inputAudioPath, id, logTail.capacity());
    }

    public UUID getId() {
        return id;
    }

    public Path getInputAudioPath() {
        return inputAudioPath;
    }

    /**
     * Audio file name without its extension, trimmed. Used as the output base name.
     */
    public String getBaseName() {
        String name = inputAudioPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return base.strip();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Id of the job this record retries, if any.
     */
    public Optional<UUID> getRetryOf() {
        return Optional.ofNullable(retryOf);
    }

    public JobStatus getStatus() {
        return status;
    }

    /**
     * Cover image snapshot taken when the job started running; {@code null} while Queued.
     */
    public Path getCoverImagePath() {
        return coverImagePath;
    }

    /**
     * Resolved destination; {@code null} until assigned just before the encoder starts.
     */
    public Path getOutputPath() {
        return outputPath;
    }

    public OptionalLong getDurationMs() {
        Long d = durationMs;
        return d == null ? OptionalLong.empty() : OptionalLong.of(d);
    }

    public Progress getProgress() {
        return progress;
    }

    /**
     * Error classification; present only when status is FAILED.
     */
    public Optional<ConversionErrorKind> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }

    /**
     * Human-readable cause; present only when status is FAILED.
     */
    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public LogTail getLogTail() {
        return logTail;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    /**
     * Records the resolved duration and resets progress to 0 (known) or indeterminate (unknown).
     *
     * @param duration resolved duration in milliseconds
     * @throws IllegalStateException if the job is not running
     */
    public void assignDuration(OptionalLong duration) {
        requireRunning("assign duration");
        progressLock.lock();
        try {
            this.durationMs = duration.isPresent() && duration.getAsLong() > 0 ? duration.getAsLong() : null;
            this.progress = Progress.initial(getDurationMs());
        } finally {
            progressLock.unlock();
        }
    }

    /**
     * Records the reserved destination path.
     *
     * @throws IllegalStateException if the job is not running
     */
    public void assignOutputPath(Path outputPath) {
        requireRunning("assign output path");
        this.outputPath = Objects.requireNonNull(outputPath, "outputPath");
    }

    /**
     * Applies a progress reading, never moving backwards.
     *
     * <p>A determinate reading lower than the current one is replaced by the current value;
     * an indeterminate reading never overrides a determinate one.
     *
     * @param candidate reading derived from the latest encoder snapshot
     * @return the effective progress after the update, or empty if the job is not running
     */
    public Optional<Progress> advanceProgress(Progress candidate) {
        Objects.requireNonNull(candidate, "candidate");
        progressLock.lock();
        try {
            if (status != JobStatus.RUNNING) {
                return Optional.empty();
            }
            Progress current = this.progress;
            Progress next;
            if (candidate.isIndeterminate()) {
                next = current;
            } else if (current.isIndeterminate()) {
                next = candidate;
            } else {
                next = candidate.fraction() >= current.fraction() ? candidate : current;
            }
            this.progress = next;
            return Optional.of(next);
        } finally {
            progressLock.unlock();
        }
    }

    // Mutators below are reserved for JobStateMachine, which holds its own transition lock.

    void setStatus(JobStatus status) {
        this.status = status;
    }

    void markStarted(Path coverSnapshot) {
        this.coverImagePath = coverSnapshot == null ? null : coverSnapshot.toAbsolutePath().normalize();
        this.startedAt = Instant.now();
    }

    void markCompleted() {
        progressLock.lock();
        try {
            this.progress = Progress.complete();
        } finally {
            progressLock.unlock();
        }
        this.finishedAt = Instant.now();
    }

    void markFailed(ConversionErrorKind kind, String message) {
        this.errorKind = kind;
        this.errorMessage = message;
        this.finishedAt = Instant.now();
    }

    void markCancelled() {
        this.finishedAt = Instant.now();
    }

    private void requireRunning(String operation) {
        if (status != JobStatus.RUNNING) {
            throw new IllegalStateException("Cannot " + operation + " for job " + id + " in status " + status);
        }
    }

    @Override
    public String toString() {
        return "ConversionJob{id=" + id + ", audio=" + inputAudioPath.getFileName()
                + ", status=" + status + ", progress=" + progress + '}';
    }
}
