package com.phillippitts.audio2video.service.encoder;

import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Inputs of a single encode.
 *
 * @param jobId owning job, used for thread names and logs
 * @param coverImage still image looped as the video track
 * @param audio source audio
 * @param output reserved destination file
 * @param durationMs audio duration, if known
 */
public record EncodeSpec(UUID jobId, Path coverImage, Path audio, Path output, OptionalLong durationMs) {

    public EncodeSpec {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(coverImage, "coverImage");
        Objects.requireNonNull(audio, "audio");
        Objects.requireNonNull(output, "output");
        durationMs = durationMs == null ? OptionalLong.empty() : durationMs;
    }
}
