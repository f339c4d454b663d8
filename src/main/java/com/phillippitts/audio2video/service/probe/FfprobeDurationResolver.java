package com.phillippitts.audio2video.service.probe;

import com.phillippitts.audio2video.config.encoder.EncoderBinaryLocator;
import com.phillippitts.audio2video.config.encoder.EncoderConfig;
import com.phillippitts.audio2video.service.process.BoundedProcessRunner;
import com.phillippitts.audio2video.service.process.DefaultProcessFactory;
import com.phillippitts.audio2video.service.process.ProcessResult;
import com.phillippitts.audio2video.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link DurationResolver} backed by ffprobe, falling back to ffmpeg's own input inspection.
 *
 * <p>Primary:
 * <pre>
 * ffprobe -v error -show_entries format=duration -of default=noprint_wrappers=1:nokey=1 ${audio}
 * </pre>
 * prints the duration in (fractional) seconds on stdout.
 *
 * <p>Fallback, used when ffprobe is missing or fails:
 * <pre>
 * ffmpeg -hide_banner -nostdin -i ${audio}
 * </pre>
 * exits non-zero (no output specified) after printing {@code Duration: HH:MM:SS.cc} on stderr.
 */
@Component
public class FfprobeDurationResolver implements DurationResolver {

    private static final Logger LOG = LogManager.getLogger(FfprobeDurationResolver.class);

    // Example: "  Duration: 00:03:25.47, start: 0.025057, bitrate: 320 kb/s"
    private static final Pattern DURATION_PATTERN =
            Pattern.compile("Duration:\\s*(\\d+):(\\d{2}):(\\d{2})(?:\\.(\\d+))?");

    private final EncoderBinaryLocator binaries;
    private final BoundedProcessRunner runner;
    private final Duration timeout;

    @Autowired
    public FfprobeDurationResolver(EncoderBinaryLocator binaries, EncoderConfig config) {
        this(binaries, new BoundedProcessRunner(new DefaultProcessFactory()),
                Duration.ofSeconds(config.probeTimeoutSeconds()));
    }

    FfprobeDurationResolver(EncoderBinaryLocator binaries, BoundedProcessRunner runner, Duration timeout) {
        this.binaries = Objects.requireNonNull(binaries, "binaries");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public OptionalLong resolveMillis(Path audioPath) {
        Objects.requireNonNull(audioPath, "audioPath");
        if (!Files.isRegularFile(audioPath)) {
            LOG.debug("Not probing missing file {}", audioPath);
            return OptionalLong.empty();
        }

        OptionalLong probed = probeWithFfprobe(audioPath);
        if (probed.isPresent()) {
            return probed;
        }
        if (Thread.currentThread().isInterrupted()) {
            LOG.debug("Duration lookup for {} interrupted; skipping ffmpeg inspection", audioPath.getFileName());
            return OptionalLong.empty();
        }
        OptionalLong inspected = inspectWithFfmpeg(audioPath);
        if (inspected.isEmpty()) {
            LOG.warn("Duration unknown for {}; progress will be indeterminate", audioPath.getFileName());
        }
        return inspected;
    }

    OptionalLong probeWithFfprobe(Path audioPath) {
        Path ffprobe = binaries.ffprobe();
        List<String> command = List.of(
                ffprobe.toString(),
                "-v", "error",
                "-show_entries", "format=duration",
                "-of", "default=noprint_wrappers=1:nokey=1",
                audioPath.toAbsolutePath().toString());
        try {
            ProcessResult result = runner.run(command, timeout);
            if (!result.isSuccess()) {
                LOG.debug("ffprobe failed for {} (exit={}, timedOut={}): {}", audioPath.getFileName(),
                        result.exitCode(), result.timedOut(), LogSanitizer.singleLine(result.stderr(), 200));
                return OptionalLong.empty();
            }
            return parseSeconds(result.stdout());
        } catch (IOException e) {
            LOG.debug("ffprobe unavailable at '{}': {}", ffprobe, e.getMessage());
            return OptionalLong.empty();
        }
    }

    OptionalLong inspectWithFfmpeg(Path audioPath) {
        Path ffmpeg = binaries.ffmpeg();
        List<String> command = List.of(
                ffmpeg.toString(),
                "-hide_banner",
                "-nostdin",
                "-i", audioPath.toAbsolutePath().toString());
        try {
            ProcessResult result = runner.run(command, timeout);
            // Exit code is non-zero by design here: no output file was requested
            return parseDurationLine(result.stderr());
        } catch (IOException e) {
            LOG.debug("ffmpeg inspection unavailable at '{}': {}", ffmpeg, e.getMessage());
            return OptionalLong.empty();
        }
    }

    /**
     * Parses ffprobe's bare seconds output ("205.470000") into milliseconds.
     */
    static OptionalLong parseSeconds(String stdout) {
        if (stdout == null) {
            return OptionalLong.empty();
        }
        String value = stdout.strip();
        int newline = value.indexOf('\n');
        if (newline >= 0) {
            value = value.substring(0, newline).strip();
        }
        if (value.isEmpty() || "N/A".equalsIgnoreCase(value)) {
            return OptionalLong.empty();
        }
        try {
            double seconds = Double.parseDouble(value);
            if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds <= 0) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(Math.round(seconds * 1000.0));
        } catch (NumberFormatException e) {
            LOG.debug("Unparseable ffprobe duration '{}'", LogSanitizer.truncate(value, 64));
            return OptionalLong.empty();
        }
    }

    /**
     * Extracts {@code Duration: HH:MM:SS.frac} from ffmpeg's diagnostic output.
     */
    static OptionalLong parseDurationLine(String stderr) {
        if (stderr == null) {
            return OptionalLong.empty();
        }
        Matcher m = DURATION_PATTERN.matcher(stderr);
        if (!m.find()) {
            return OptionalLong.empty();
        }
        long hours = Long.parseLong(m.group(1));
        long minutes = Long.parseLong(m.group(2));
        long seconds = Long.parseLong(m.group(3));
        long millis = 0;
        String fraction = m.group(4);
        if (fraction != null) {
            // ".47" is 470ms, ".5" is 500ms, ".123456" is 123ms
            String padded = (fraction + "000").substring(0, 3);
            millis = Long.parseLong(padded);
        }
        long total = ((hours * 60 + minutes) * 60 + seconds) * 1000 + millis;
        return total > 0 ? OptionalLong.of(total) : OptionalLong.empty();
    }
}
