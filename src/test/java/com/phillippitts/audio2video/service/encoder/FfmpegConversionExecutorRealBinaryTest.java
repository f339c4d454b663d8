package com.phillippitts.audio2video.service.encoder;

import com.phillippitts.audio2video.annotation.RequiresRealBinary;
import com.phillippitts.audio2video.config.encoder.EncoderBinaryLocator;
import com.phillippitts.audio2video.config.encoder.EncoderConfig;
import com.phillippitts.audio2video.config.properties.ConversionProperties;
import com.phillippitts.audio2video.domain.LogTail;
import com.phillippitts.audio2video.service.probe.FfprobeDurationResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@RequiresRealBinary("ffmpeg and ffprobe on PATH or in bin/")
class FfmpegConversionExecutorRealBinaryTest {

    @TempDir
    Path tempDir;

    private EncoderBinaryLocator binaries;
    private Path audio;
    private Path cover;

    @BeforeEach
    void setUp() throws Exception {
        EncoderConfig config = new EncoderConfig("ffmpeg", "ffprobe", 15);
        binaries = new EncoderBinaryLocator(config);
        assumeTrue(EncoderBinaryLocator.isExecutable(binaries.ffmpeg()), "ffmpeg not available");

        audio = tempDir.resolve("tone.wav");
        cover = tempDir.resolve("cover.png");
        generate("-f", "lavfi", "-i", "sine=frequency=440:duration=2", audio.toString());
        generate("-f", "lavfi", "-i", "color=c=blue:s=320x240", "-frames:v", "1", cover.toString());
    }

    @Test
    void encodesStillImageWithAudioIntoMpeg() {
        FfprobeDurationResolver probe = new FfprobeDurationResolver(binaries,
                new EncoderConfig("ffmpeg", "ffprobe", 15));
        OptionalLong duration = probe.resolveMillis(audio);
        assertThat(duration).isPresent();
        assertThat(duration.getAsLong()).isBetween(1_900L, 2_100L);

        Path output = tempDir.resolve("tone.mpg");
        List<ProgressSnapshot> snapshots = new CopyOnWriteArrayList<>();
        LogTail logTail = new LogTail(20);
        FfmpegConversionExecutor executor = new FfmpegConversionExecutor(binaries, new ConversionProperties());

        EncodeOutcome outcome = executor.start(new EncodeSpec(UUID.randomUUID(), cover, audio, output, duration),
                snapshots::add, logTail).await();

        assertThat(outcome.isSuccess()).as("log tail: %s", logTail).isTrue();
        assertThat(output).exists();
        assertThat(output.toFile().length()).isPositive();
        assertThat(snapshots).isNotEmpty();
        assertThat(snapshots.get(snapshots.size() - 1).ended()).isTrue();
    }

    private void generate(String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>(List.of(binaries.ffmpeg().toString(),
                "-hide_banner", "-loglevel", "error", "-y"));
        command.addAll(List.of(args));
        Process process = new ProcessBuilder(command).redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
        assertThat(process.waitFor(30, TimeUnit.SECONDS)).isTrue();
        assertThat(process.exitValue()).isZero();
        assertThat(Path.of(args[args.length - 1])).exists();
    }
}
