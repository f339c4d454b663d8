package com.phillippitts.audio2video.service.orchestration;

import com.phillippitts.audio2video.domain.ConversionJob;
import com.phillippitts.audio2video.domain.JobStateMachine;
import com.phillippitts.audio2video.domain.JobStatus;
import com.phillippitts.audio2video.domain.Progress;
import com.phillippitts.audio2video.exception.Audio2VideoException;
import com.phillippitts.audio2video.exception.ConversionErrorKind;
import com.phillippitts.audio2video.exception.ConversionException;
import com.phillippitts.audio2video.exception.ConversionExceptionBuilder;
import com.phillippitts.audio2video.exception.EmptyAudioListException;
import com.phillippitts.audio2video.exception.JobNotFoundException;
import com.phillippitts.audio2video.exception.MissingCoverImageException;
import com.phillippitts.audio2video.service.encoder.ConversionExecutor;
import com.phillippitts.audio2video.service.encoder.EncodeHandle;
import com.phillippitts.audio2video.service.encoder.EncodeOutcome;
import com.phillippitts.audio2video.service.encoder.EncodeSpec;
import com.phillippitts.audio2video.service.encoder.EncoderConstants;
import com.phillippitts.audio2video.service.encoder.ProgressSnapshot;
import com.phillippitts.audio2video.service.metrics.ConversionMetrics;
import com.phillippitts.audio2video.service.naming.OutputPathResolver;
import com.phillippitts.audio2video.service.orchestration.event.JobProgressEvent;
import com.phillippitts.audio2video.service.orchestration.event.JobStatusChangedEvent;
import com.phillippitts.audio2video.service.orchestration.event.JobSubmittedEvent;
import com.phillippitts.audio2video.service.orchestration.event.QueueDrainedEvent;
import com.phillippitts.audio2video.service.probe.DurationResolver;
import com.phillippitts.audio2video.service.queue.JobQueue;
import com.phillippitts.audio2video.service.queue.QueueClearResult;
import com.phillippitts.audio2video.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link ConversionController}.
 *
 * <p><b>Workers:</b> {@link #start()} submits up to W worker loops to the executor. Each loop
 * claims the oldest Queued job, runs it to a terminal status and claims the next one, until
 * nothing is Queued or the queue is halted. The last loop to exit publishes
 * {@link QueueDrainedEvent}.
 *
 * <p><b>Per job:</b> check inputs, resolve duration, reserve the output name, spawn the
 * encoder, await its outcome, finalize the status. The reservation is released whatever
 * the outcome.
 *
 * <p><b>Cancellation:</b> requests are recorded per job id before the handle is looked up,
 * and re-checked by the worker after each preparation step, so a cancel that arrives
 * between steps is never lost. A worker still resolving the duration is interrupted.
 *
 * <p><b>Output directory:</b> fixed for the whole run when {@link #start()} is called and
 * created again per job if it disappeared; a later {@link #setOutputDirectory(Path)} applies
 * to the next run.
 *
 * <p><b>Errors:</b> job-level failures stay on the job. A queue-fatal failure (the encoder
 * cannot be launched) fails every Queued job with the same cause and stops dispatch;
 * jobs already Running finish normally.
 *
 * <p><b>Thread Safety:</b> claiming, worker bookkeeping and queue mutations run under one
 * lock; status changes go through {@link JobStateMachine}, which has its own.
 *
 * @since 1.0
 */
public class DefaultConversionController implements ConversionController {

    private static final Logger LOG = LogManager.getLogger(DefaultConversionController.class);

    static final String MDC_JOB_ID = "jobId";
    private static final int MAX_ERROR_CHARS = 300;

    private final JobQueue queue;
    private final JobStateMachine stateMachine;
    private final DurationResolver durationResolver;
    private final OutputPathResolver pathResolver;
    private final ConversionExecutor executor;
    private final ApplicationEventPublisher publisher;
    private final Executor workerExecutor;
    private final ConversionMetrics metrics;
    private final int concurrency;
    private final int logTailLines;

    private final Lock lock = new ReentrantLock();
    private final Map<UUID, EncodeHandle> activeHandles = new ConcurrentHashMap<>();
    private final Set<UUID> cancelRequests = ConcurrentHashMap.newKeySet();
    private final Map<UUID, Thread> preparingWorkers = new ConcurrentHashMap<>();

    private volatile Path coverImage;
    private volatile Path outputDirectory;
    private volatile Path runOutputDirectory;

    // guarded by lock
    private boolean running;
    private boolean halted;
    private int activeWorkers;

    DefaultConversionController(ConversionControllerBuilder b) {
        this.queue = b.queue;
        this.stateMachine = b.stateMachine;
        this.durationResolver = b.durationResolver;
        this.pathResolver = b.pathResolver;
        this.executor = b.executor;
        this.publisher = b.publisher;
        this.workerExecutor = b.workerExecutor;
        this.metrics = b.metrics;
        this.concurrency = b.concurrency;
        this.logTailLines = b.logTailLines;
        this.outputDirectory = b.outputDirectory.toAbsolutePath().normalize();
    }

    @Override
    public List<ConversionJob> submit(List<Path> audioPaths) {
        if (audioPaths == null || audioPaths.isEmpty()) {
            throw new EmptyAudioListException();
        }
        List<ConversionJob> created = new ArrayList<>(audioPaths.size());
        for (Path audio : audioPaths) {
            Objects.requireNonNull(audio, "audio path must not be null");
            ConversionJob job = ConversionJob.create(audio, logTailLines);
            queue.append(job);
            created.add(job);
            publisher.publishEvent(new JobSubmittedEvent(job.getId(), job.getInputAudioPath(), null, Instant.now()));
        }
        LOG.info("Submitted {} audio file(s)", created.size());
        return created;
    }

    @Override
    public void selectCoverImage(Path coverImage) {
        this.coverImage = Objects.requireNonNull(coverImage, "coverImage").toAbsolutePath().normalize();
        LOG.debug("Cover image set to {}", this.coverImage);
    }

    @Override
    public Optional<Path> getCoverImage() {
        return Optional.ofNullable(coverImage);
    }

    @Override
    public void setOutputDirectory(Path outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
        LOG.debug("Output directory set to {}", this.outputDirectory);
    }

    @Override
    public Path getOutputDirectory() {
        return outputDirectory;
    }

    @Override
    public void start() {
        lock.lock();
        try {
            if (running) {
                LOG.debug("start() ignored: already running");
                return;
            }
            Path cover = coverImage;
            if (cover == null) {
                throw new MissingCoverImageException();
            }
            if (!Files.isRegularFile(cover)) {
                throw new MissingCoverImageException(cover.toString());
            }
            if (queue.size() == 0) {
                throw new EmptyAudioListException();
            }
            if (queue.nextQueued().isEmpty()) {
                LOG.debug("start() ignored: no queued jobs");
                return;
            }
            Path directory = outputDirectory;
            createOutputDirectory(directory);
            runOutputDirectory = directory;

            running = true;
            halted = false;
            LOG.info("Starting conversion of {} queued job(s) with {} worker(s)",
                    queue.withStatus(JobStatus.QUEUED).size(), concurrency);
            spawnWorkers();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void cancel(UUID jobId) {
        ConversionJob job = queue.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        switch (job.getStatus()) {
            case QUEUED -> {
                if (stateMachine.cancelQueued(job)) {
                    LOG.info("Cancelled queued job {}", jobId);
                    metrics.incrementCancelled();
                    publishStatus(job);
                } else {
                    // a worker claimed it in the meantime
                    requestRunningCancel(job);
                }
            }
            case RUNNING -> requestRunningCancel(job);
            default -> LOG.debug("cancel({}) ignored: job already {}", jobId, job.getStatus());
        }
    }

    void requestRunningCancel(ConversionJob job) {
        UUID jobId = job.getId();
        cancelRequests.add(jobId);
        if (job.getStatus() != JobStatus.RUNNING) {
            // finished meanwhile; its worker may already have cleared the request set
            cancelRequests.remove(jobId);
            return;
        }
        preparingWorkers.computeIfPresent(jobId, (id, worker) -> {
            worker.interrupt();
            return worker;
        });
        EncodeHandle handle = activeHandles.get(jobId);
        if (handle != null) {
            handle.cancel();
        }
        LOG.info("Cancellation requested for running job {}", jobId);
    }

    boolean hasPendingCancel(UUID jobId) {
        return cancelRequests.contains(jobId);
    }

    @Override
    public int cancelAll() {
        int issued = 0;
        for (ConversionJob job : queue.snapshot()) {
            if (!job.getStatus().isTerminal()) {
                cancel(job.getId());
                issued++;
            }
        }
        return issued;
    }

    @Override
    public ConversionJob retry(UUID jobId) {
        ConversionJob original = queue.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        ConversionJob fresh = stateMachine.retry(original);
        lock.lock();
        try {
            queue.append(fresh);
            if (running && !halted) {
                spawnWorkers();
            }
        } finally {
            lock.unlock();
        }
        publisher.publishEvent(new JobSubmittedEvent(fresh.getId(), fresh.getInputAudioPath(), jobId, Instant.now()));
        LOG.info("Retrying job {} as {}", jobId, fresh.getId());
        return fresh;
    }

    @Override
    public void remove(UUID jobId) {
        lock.lock();
        try {
            queue.remove(jobId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueClearResult clearAll() {
        lock.lock();
        try {
            return queue.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ConversionJob> getJobs() {
        return queue.snapshot();
    }

    @Override
    public Optional<ConversionJob> findJob(UUID jobId) {
        return queue.find(jobId);
    }

    @Override
    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    // must hold lock
    private void spawnWorkers() {
        int queued = queue.withStatus(JobStatus.QUEUED).size();
        boolean rejected = false;
        while (running && activeWorkers < concurrency && queued > 0) {
            activeWorkers++;
            queued--;
            try {
                workerExecutor.execute(this::workerLoop);
            } catch (RejectedExecutionException e) {
                activeWorkers--;
                rejected = true;
                LOG.warn("Worker pool rejected a conversion worker: {}", e.toString());
                break;
            }
        }
        if (rejected && running && activeWorkers == 0) {
            halt(ConversionExceptionBuilder.create(ConversionErrorKind.LAUNCH_FAILED,
                    "No conversion worker could be started").build());
            finishRun();
        }
    }

    private void workerLoop() {
        boolean retired = false;
        try {
            ConversionJob job;
            while ((job = claimNextOrRetire()) != null) {
                runJob(job);
            }
            retired = true;
        } finally {
            if (!retired) {
                lock.lock();
                try {
                    retireWorker();
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    // must hold lock
    private void retireWorker() {
        activeWorkers--;
        if (activeWorkers == 0) {
            finishRun();
        }
    }

    // must hold lock
    private void finishRun() {
        if (!running) {
            return;
        }
        running = false;
        int completed = queue.withStatus(JobStatus.COMPLETED).size();
        int failed = queue.withStatus(JobStatus.FAILED).size();
        int cancelled = queue.withStatus(JobStatus.CANCELLED).size();
        publisher.publishEvent(new QueueDrainedEvent(completed, failed, cancelled, halted, Instant.now()));
    }

    /**
     * Moves the oldest Queued job to Running. When there is none, or the queue is halted, the
     * calling worker is retired in the same critical section and {@code null} is returned.
     */
    private ConversionJob claimNextOrRetire() {
        lock.lock();
        try {
            while (!halted) {
                Optional<ConversionJob> next = queue.nextQueued();
                if (next.isEmpty()) {
                    break;
                }
                ConversionJob job = next.get();
                if (stateMachine.start(job, coverImage)) {
                    publishStatus(job);
                    return job;
                }
                // cancelled between lookup and transition; try the next one
            }
            retireWorker();
            return null;
        } finally {
            lock.unlock();
        }
    }

    private void runJob(ConversionJob job) {
        ThreadContext.put(MDC_JOB_ID, job.getId().toString());
        Path reserved = null;
        try {
            if (cancelledBeforeSpawn(job)) {
                return;
            }
            requireInputs(job);

            OptionalLong duration = resolveDuration(job);
            if (cancelledBeforeSpawn(job)) {
                return;
            }
            if (duration.isEmpty()) {
                metrics.incrementUnknownDuration();
            }
            job.assignDuration(duration);

            Path directory = runOutputDirectory;
            ensureJobOutputDirectory(directory);
            reserved = pathResolver.reserve(directory, job.getBaseName(), EncoderConstants.OUTPUT_EXTENSION);
            job.assignOutputPath(reserved);
            if (cancelledBeforeSpawn(job)) {
                return;
            }

            EncodeSpec spec = new EncodeSpec(job.getId(), job.getCoverImagePath(), job.getInputAudioPath(),
                    reserved, job.getDurationMs());
            LOG.info("Converting {} -> {} (cover {})", job.getInputAudioPath().getFileName(), reserved.getFileName(),
                    job.getCoverImagePath());
            EncodeHandle handle = executor.start(spec, snapshot -> onProgress(job, snapshot), job.getLogTail());
            activeHandles.put(job.getId(), handle);
            if (cancelRequests.contains(job.getId())) {
                handle.cancel();
            }
            EncodeOutcome outcome;
            try {
                outcome = handle.await();
            } finally {
                activeHandles.remove(job.getId());
            }
            finish(job, outcome);
        } catch (ConversionException e) {
            failJob(job, e);
            if (e.getKind().isQueueFatal()) {
                halt(e);
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected error while converting {}", job.getInputAudioPath(), e);
            failJob(job, ConversionExceptionBuilder.create(ConversionErrorKind.ENCODER_IO_FAILURE,
                    "Unexpected error: " + e).cause(e).build());
        } finally {
            cancelRequests.remove(job.getId());
            pathResolver.release(reserved);
            ThreadContext.remove(MDC_JOB_ID);
        }
    }

    private boolean cancelledBeforeSpawn(ConversionJob job) {
        if (!cancelRequests.contains(job.getId())) {
            return false;
        }
        if (stateMachine.cancel(job)) {
            LOG.info("Job cancelled before the encoder started");
            metrics.incrementCancelled();
            publishStatus(job);
        }
        return true;
    }

    private void requireInputs(ConversionJob job) {
        if (!Files.isRegularFile(job.getInputAudioPath())) {
            throw ConversionExceptionBuilder.create(ConversionErrorKind.INPUT_MISSING,
                            "Audio file not found: " + job.getInputAudioPath())
                    .build();
        }
        Path cover = job.getCoverImagePath();
        if (cover == null || !Files.isRegularFile(cover)) {
            throw ConversionExceptionBuilder.create(ConversionErrorKind.INPUT_MISSING,
                            "Cover image not found: " + cover)
                    .build();
        }
    }

    /**
     * Runs the duration lookup interruptibly: a cancel arriving meanwhile interrupts this
     * worker, and the interrupt is consumed here once the lookup has returned.
     */
    private OptionalLong resolveDuration(ConversionJob job) {
        UUID jobId = job.getId();
        preparingWorkers.put(jobId, Thread.currentThread());
        try {
            if (cancelRequests.contains(jobId)) {
                return OptionalLong.empty();
            }
            return durationResolver.resolveMillis(job.getInputAudioPath());
        } catch (RuntimeException e) {
            LOG.warn("{}: {}", ConversionErrorKind.PROBE_FAILED.summary(), e.toString());
            return OptionalLong.empty();
        } finally {
            preparingWorkers.remove(jobId);
            if (cancelRequests.contains(jobId) && Thread.interrupted()) {
                LOG.debug("Duration lookup interrupted by cancellation");
            }
        }
    }

    private static void ensureJobOutputDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw ConversionExceptionBuilder.create(ConversionErrorKind.ENCODER_IO_FAILURE,
                            "Cannot create output directory " + directory + ": " + e.getMessage())
                    .cause(e)
                    .build();
        }
    }

    private void onProgress(ConversionJob job, ProgressSnapshot snapshot) {
        Progress candidate = snapshot.toProgress(job.getDurationMs());
        job.advanceProgress(candidate).ifPresent(progress ->
                publisher.publishEvent(new JobProgressEvent(job.getId(), progress, snapshot.outTimeMs(),
                        snapshot.speed(), Instant.now())));
    }

    private void finish(ConversionJob job, EncodeOutcome outcome) {
        switch (outcome.status()) {
            case SUCCEEDED -> {
                if (stateMachine.complete(job)) {
                    metrics.recordLatency("succeeded", outcome.durationMs());
                    metrics.incrementSuccess();
                    if (job.getDurationMs().isPresent()) {
                        publisher.publishEvent(new JobProgressEvent(job.getId(), Progress.complete(),
                                job.getDurationMs().getAsLong(), null, Instant.now()));
                    }
                    publishStatus(job);
                }
            }
            case CANCELLED -> {
                if (stateMachine.cancel(job)) {
                    metrics.recordLatency("cancelled", outcome.durationMs());
                    metrics.incrementCancelled();
                    publishStatus(job);
                }
            }
            case FAILED -> {
                metrics.recordLatency("failed", outcome.durationMs());
                failJob(job, outcome.failure());
            }
        }
    }

    private void failJob(ConversionJob job, ConversionException e) {
        String message = LogSanitizer.singleLine(e.getMessage(), MAX_ERROR_CHARS);
        if (stateMachine.fail(job, e.getKind(), message)) {
            metrics.incrementFailure(e.getKind());
            publishStatus(job);
        }
    }

    /**
     * Stops dispatch and fails every job still Queued with the same cause.
     */
    private void halt(ConversionException cause) {
        List<ConversionJob> waiting;
        lock.lock();
        try {
            halted = true;
            waiting = queue.withStatus(JobStatus.QUEUED);
        } finally {
            lock.unlock();
        }
        LOG.error("Halting conversion queue: {}", cause.getMessage());
        String message = LogSanitizer.singleLine(cause.getMessage(), MAX_ERROR_CHARS);
        for (ConversionJob job : waiting) {
            if (stateMachine.fail(job, cause.getKind(), message)) {
                metrics.incrementFailure(cause.getKind());
                publishStatus(job);
            }
        }
    }

    private void publishStatus(ConversionJob job) {
        JobStatus status = job.getStatus();
        boolean failed = status == JobStatus.FAILED;
        publisher.publishEvent(new JobStatusChangedEvent(
                job.getId(),
                status,
                job.getOutputPath(),
                job.getErrorKind().orElse(null),
                job.getErrorMessage().orElse(null),
                failed ? job.getLogTail().lines() : List.of(),
                Instant.now()));
    }

    private static void createOutputDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new Audio2VideoException("Cannot create output directory " + directory, e);
        }
    }
}
