package com.phillippitts.audio2video.config.encoder;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external encoder and its metadata probe.
 * Binds to properties prefixed with "encoder".
 *
 * <p>Example application.properties:
 * <pre>
 * encoder.ffmpeg-path=bin/ffmpeg
 * encoder.ffprobe-path=bin/ffprobe
 * encoder.probe-timeout-seconds=15
 * </pre>
 *
 * <p>Bare names ("ffmpeg") are looked up in the bundled {@code bin/} directory and then on
 * {@code PATH}; see {@link EncoderBinaryLocator}. The encode parameters themselves are fixed
 * and not configurable.
 *
 * @param ffmpegPath path or name of the ffmpeg executable
 * @param ffprobePath path or name of the ffprobe executable
 * @param probeTimeoutSeconds maximum time a duration probe may run
 */
@ConfigurationProperties(prefix = "encoder")
@Validated
public record EncoderConfig(
        @NotBlank(message = "ffmpeg path must not be blank")
        @DefaultValue("ffmpeg")
        String ffmpegPath,

        @NotBlank(message = "ffprobe path must not be blank")
        @DefaultValue("ffprobe")
        String ffprobePath,

        @Positive(message = "Probe timeout must be positive")
        @DefaultValue("15")
        int probeTimeoutSeconds
) {
}
