package com.phillippitts.audio2video.service.queue;

import com.phillippitts.audio2video.domain.ConversionJob;
import com.phillippitts.audio2video.domain.JobStatus;
import com.phillippitts.audio2video.exception.JobBusyException;
import com.phillippitts.audio2video.exception.JobNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered collection of conversion jobs.
 *
 * <p>Jobs keep insertion order and are dequeued in that order. Finished jobs stay in the
 * queue as history until removed. Running jobs can be neither removed nor cleared.
 *
 * <p>Every mutation is serialized on one lock; reads return copies.
 */
@Component
public class JobQueue {

    private static final Logger LOG = LogManager.getLogger(JobQueue.class);

    private final List<ConversionJob> jobs = new ArrayList<>();
    private final Lock lock = new ReentrantLock();

    /**
     * Appends a job at the tail.
     */
    public void append(ConversionJob job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            jobs.add(job);
        } finally {
            lock.unlock();
        }
        LOG.debug("Queued {} ({})", job.getInputAudioPath().getFileName(), job.getId());
    }

    /**
     * Removes a job that is not Running.
     *
     * @return the removed job
     * @throws JobBusyException if the job is Running
     * @throws JobNotFoundException if no job has this id
     */
    public ConversionJob remove(UUID jobId) {
        lock.lock();
        try {
            Iterator<ConversionJob> it = jobs.iterator();
            while (it.hasNext()) {
                ConversionJob job = it.next();
                if (job.getId().equals(jobId)) {
                    if (job.getStatus() == JobStatus.RUNNING) {
                        throw new JobBusyException(jobId);
                    }
                    it.remove();
                    return job;
                }
            }
        } finally {
            lock.unlock();
        }
        throw new JobNotFoundException(jobId);
    }

    /**
     * Removes every job except the Running ones.
     *
     * @return what was removed and which Running jobs were kept
     */
    public QueueClearResult clear() {
        List<UUID> removed = new ArrayList<>();
        List<UUID> retained = new ArrayList<>();
        lock.lock();
        try {
            Iterator<ConversionJob> it = jobs.iterator();
            while (it.hasNext()) {
                ConversionJob job = it.next();
                if (job.getStatus() == JobStatus.RUNNING) {
                    retained.add(job.getId());
                } else {
                    removed.add(job.getId());
                    it.remove();
                }
            }
        } finally {
            lock.unlock();
        }
        if (!retained.isEmpty()) {
            LOG.info("Cleared {} jobs; {} running jobs retained", removed.size(), retained.size());
        }
        return new QueueClearResult(removed, retained);
    }

    /**
     * Oldest job still Queued, without changing it.
     */
    public Optional<ConversionJob> nextQueued() {
        lock.lock();
        try {
            for (ConversionJob job : jobs) {
                if (job.getStatus() == JobStatus.QUEUED) {
                    return Optional.of(job);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public Optional<ConversionJob> find(UUID jobId) {
        lock.lock();
        try {
            for (ConversionJob job : jobs) {
                if (job.getId().equals(jobId)) {
                    return Optional.of(job);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the queue in insertion order.
     */
    public List<ConversionJob> snapshot() {
        lock.lock();
        try {
            return List.copyOf(jobs);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Jobs currently in {@code status}, in insertion order.
     */
    public List<ConversionJob> withStatus(JobStatus status) {
        List<ConversionJob> result = new ArrayList<>();
        lock.lock();
        try {
            for (ConversionJob job : jobs) {
                if (job.getStatus() == status) {
                    result.add(job);
                }
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }
}
