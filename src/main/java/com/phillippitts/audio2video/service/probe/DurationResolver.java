package com.phillippitts.audio2video.service.probe;

import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * Determines the total duration of an audio file.
 *
 * <p>An empty result means "unknown duration". That is a valid outcome: the job still runs,
 * with indeterminate progress.
 */
@FunctionalInterface
public interface DurationResolver {

    /**
     * Resolves the duration of {@code audioPath}. Blocks for at most the configured probe timeout
     * per attempt; must be called from a background thread.
     *
     * @param audioPath absolute path of the audio file
     * @return duration in milliseconds, or empty when it cannot be determined
     */
    OptionalLong resolveMillis(Path audioPath);
}
