package com.phillippitts.audio2video.service.naming;

import com.phillippitts.audio2video.exception.ConversionErrorKind;
import com.phillippitts.audio2video.exception.ConversionExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Computes collision-free output paths and reserves them for the running batch.
 *
 * <p>Candidates are tried in order: {@code base.ext}, {@code base (1).ext}, {@code base (2).ext}, ...
 * A candidate is free when no file exists at that path and no other job holds a reservation
 * on it. Resolution and reservation happen in one critical section, so concurrent workers
 * never receive the same path.
 *
 * <p>Reservations are released when the owning job ends. A completed job's file then keeps
 * the name taken on disk; a failed or cancelled job's partial file is deleted and the name
 * becomes free again.
 */
@Component
public class OutputPathResolver {

    private static final Logger LOG = LogManager.getLogger(OutputPathResolver.class);

    /** Upper bound on numbered candidates before giving up. */
    public static final int MAX_ATTEMPTS = 10_000;

    private static final String FALLBACK_BASE_NAME = "output";

    private final Lock lock = new ReentrantLock();
    private final Set<Path> reserved = new HashSet<>();
    private final int maxAttempts;

    public OutputPathResolver() {
        this(MAX_ATTEMPTS);
    }

    OutputPathResolver(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * Finds the first free name and reserves it.
     *
     * @param directory destination folder
     * @param baseName file name without extension
     * @param extension extension with or without the leading dot
     * @return reserved absolute path
     * @throws com.phillippitts.audio2video.exception.ConversionException with kind
     *         {@link ConversionErrorKind#NAMING_COLLISION_EXHAUSTED} when every candidate is taken
     */
    public Path reserve(Path directory, String baseName, String extension) {
        Objects.requireNonNull(directory, "directory");
        Path dir = directory.toAbsolutePath().normalize();
        String base = normalizeBase(baseName);
        String ext = normalizeExtension(extension);

        lock.lock();
        try {
            Path candidate = dir.resolve(base + ext);
            if (isFree(candidate)) {
                return claim(candidate);
            }
            for (int n = 1; n < maxAttempts; n++) {
                candidate = dir.resolve(base + " (" + n + ")" + ext);
                if (isFree(candidate)) {
                    return claim(candidate);
                }
            }
        } finally {
            lock.unlock();
        }
        throw ConversionExceptionBuilder.create(ConversionErrorKind.NAMING_COLLISION_EXHAUSTED,
                        "No free output name after " + maxAttempts + " attempts")
                .metadata("directory", dir)
                .metadata("baseName", base)
                .build();
    }

    /**
     * Drops the reservation on {@code path}; unknown paths are ignored.
     */
    public void release(Path path) {
        if (path == null) {
            return;
        }
        lock.lock();
        try {
            if (reserved.remove(path.toAbsolutePath().normalize())) {
                LOG.debug("Released output reservation {}", path.getFileName());
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isReserved(Path path) {
        lock.lock();
        try {
            return reserved.contains(path.toAbsolutePath().normalize());
        } finally {
            lock.unlock();
        }
    }

    public int reservationCount() {
        lock.lock();
        try {
            return reserved.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean isFree(Path candidate) {
        return !reserved.contains(candidate) && !Files.exists(candidate);
    }

    private Path claim(Path candidate) {
        reserved.add(candidate);
        LOG.debug("Reserved output path {}", candidate);
        return candidate;
    }

    private static String normalizeBase(String baseName) {
        String base = baseName == null ? "" : baseName.strip();
        return base.isEmpty() ? FALLBACK_BASE_NAME : base;
    }

    private static String normalizeExtension(String extension) {
        Objects.requireNonNull(extension, "extension");
        String ext = extension.strip();
        if (ext.isEmpty()) {
            throw new IllegalArgumentException("extension must not be blank");
        }
        return ext.startsWith(".") ? ext : "." + ext;
    }
}
