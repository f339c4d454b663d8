package com.phillippitts.audio2video.service.health;

import com.phillippitts.audio2video.config.encoder.EncoderBinaryLocator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Health indicator for the encoder binaries.
 *
 * <p>UP when ffmpeg resolves to an executable file. ffprobe is optional (duration falls back
 * to ffmpeg's inspection), so it only appears as a detail.
 */
@Component
public class EncoderHealthIndicator implements HealthIndicator {

    private final EncoderBinaryLocator binaries;

    public EncoderHealthIndicator(EncoderBinaryLocator binaries) {
        this.binaries = binaries;
    }

    @Override
    public Health health() {
        Path ffmpeg = binaries.ffmpeg();
        Path ffprobe = binaries.ffprobe();
        boolean ffmpegOk = EncoderBinaryLocator.isExecutable(ffmpeg);
        boolean ffprobeOk = EncoderBinaryLocator.isExecutable(ffprobe);

        Health.Builder builder = ffmpegOk ? Health.up() : Health.down();
        return builder
                .withDetail("ffmpeg", formatStatus(ffmpegOk, ffmpeg))
                .withDetail("ffprobe", formatStatus(ffprobeOk, ffprobe))
                .build();
    }

    private String formatStatus(boolean executable, Path path) {
        if (executable) {
            return "executable at " + path;
        }
        return "NOT FOUND at " + path;
    }
}
