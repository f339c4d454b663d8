package com.phillippitts.audio2video.service.orchestration;

import com.phillippitts.audio2video.domain.ConversionJob;
import com.phillippitts.audio2video.service.queue.QueueClearResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives batch conversion: owns the job queue and runs Queued jobs through the encoder.
 *
 * <p>Every control operation returns without waiting for encoder work; encodes run on
 * background workers, at most {@code conversion.concurrency} at a time. Status changes and
 * progress are published as application events from the
 * {@code service.orchestration.event} package.
 *
 * <p><b>Typical session:</b>
 * <pre>{@code
 * controller.selectCoverImage(Path.of("cover.jpg"));
 * controller.setOutputDirectory(Path.of("exports"));
 * controller.submit(List.of(Path.of("a.mp3"), Path.of("b.wav")));
 * controller.start();
 * // ... JobStatusChangedEvent / JobProgressEvent ... QueueDrainedEvent
 * }</pre>
 *
 * <p><b>Thread Safety:</b> implementations must be safe to call from any thread.
 *
 * @since 1.0
 */
public interface ConversionController {

    /**
     * Appends one Queued job per audio path, in order. Paths are not checked here; a missing
     * file fails its job when the job is scheduled.
     *
     * @return the new jobs
     * @throws com.phillippitts.audio2video.exception.EmptyAudioListException if {@code audioPaths} is empty
     */
    List<ConversionJob> submit(List<Path> audioPaths);

    /**
     * Sets the cover image used by jobs that start from now on. Running jobs keep the image
     * they started with.
     */
    void selectCoverImage(Path coverImage);

    Optional<Path> getCoverImage();

    /**
     * Sets the destination folder for jobs that start from now on.
     */
    void setOutputDirectory(Path outputDirectory);

    Path getOutputDirectory();

    /**
     * Begins draining Queued jobs. No-op when already running or when nothing is Queued.
     *
     * @throws com.phillippitts.audio2video.exception.MissingCoverImageException if no cover is selected or it does not exist
     * @throws com.phillippitts.audio2video.exception.EmptyAudioListException if the queue holds no jobs at all
     */
    void start();

    /**
     * Cancels a job. A Queued job becomes Cancelled at once; a Running job is terminated
     * asynchronously; a finished job is left alone.
     *
     * @throws com.phillippitts.audio2video.exception.JobNotFoundException for an unknown id
     */
    void cancel(UUID jobId);

    /**
     * Cancels every Queued and Running job.
     *
     * @return number of jobs a cancellation was issued for
     */
    int cancelAll();

    /**
     * Enqueues a fresh job for a Failed or Cancelled one. The old record stays as it is.
     *
     * @return the new Queued job
     * @throws com.phillippitts.audio2video.exception.IllegalJobTransitionException if the job is not Failed or Cancelled
     * @throws com.phillippitts.audio2video.exception.JobNotFoundException for an unknown id
     */
    ConversionJob retry(UUID jobId);

    /**
     * @throws com.phillippitts.audio2video.exception.JobBusyException if the job is Running
     * @throws com.phillippitts.audio2video.exception.JobNotFoundException for an unknown id
     */
    void remove(UUID jobId);

    /**
     * Removes every job that is not Running.
     */
    QueueClearResult clearAll();

    /**
     * Current jobs in queue order.
     */
    List<ConversionJob> getJobs();

    Optional<ConversionJob> findJob(UUID jobId);

    /**
     * Whether workers are draining the queue.
     */
    boolean isRunning();
}
