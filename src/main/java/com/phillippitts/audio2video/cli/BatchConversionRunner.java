package com.phillippitts.audio2video.cli;

import com.phillippitts.audio2video.exception.Audio2VideoException;
import com.phillippitts.audio2video.exception.EmptyAudioListException;
import com.phillippitts.audio2video.exception.MissingCoverImageException;
import com.phillippitts.audio2video.service.orchestration.ConversionController;
import com.phillippitts.audio2video.service.orchestration.event.QueueDrainedEvent;
import com.phillippitts.audio2video.util.MediaFileTypes;
import com.phillippitts.audio2video.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line front end: converts the audio files named on the command line and waits for
 * the batch to finish.
 *
 * <pre>
 * java -jar audio2video.jar --cover=cover.jpg [--output=exports] [--conversion.concurrency=2] a.mp3 b.wav ...
 * </pre>
 *
 * <p>Files with an unsupported extension are skipped with a warning. Without positional
 * arguments the runner does nothing. The process exit code is 1 when any job failed.
 */
@Component
@ConditionalOnProperty(prefix = "audio2video.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BatchConversionRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LogManager.getLogger(BatchConversionRunner.class);

    static final String OPTION_COVER = "cover";
    static final String OPTION_OUTPUT = "output";

    private final ConversionController controller;

    private volatile CountDownLatch drained;
    private volatile QueueDrainedEvent summary;

    public BatchConversionRunner(ConversionController controller) {
        this.controller = controller;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            LOG.debug("No audio files on the command line; batch runner idle");
            return;
        }

        Path cover = Path.of(requireSingleOption(args, OPTION_COVER));
        if (!MediaFileTypes.isSupportedImage(cover)) {
            throw new Audio2VideoException("Unsupported cover image type: " + cover.getFileName()
                    + " (expected one of " + MediaFileTypes.IMAGE_EXTENSIONS + ")");
        }
        controller.selectCoverImage(cover);
        if (args.containsOption(OPTION_OUTPUT)) {
            controller.setOutputDirectory(Path.of(requireSingleOption(args, OPTION_OUTPUT)));
        }

        List<Path> audio = new ArrayList<>();
        for (String arg : positional) {
            Path path = Path.of(arg);
            if (MediaFileTypes.isSupportedAudio(path)) {
                audio.add(path);
            } else {
                LOG.warn("Skipping unsupported file {}", path.getFileName());
            }
        }
        if (audio.isEmpty()) {
            throw new EmptyAudioListException();
        }

        drained = new CountDownLatch(1);
        long startNanos = System.nanoTime();
        controller.submit(audio);
        controller.start();
        LOG.info("Converting {} file(s) into {}", audio.size(), controller.getOutputDirectory());

        try {
            drained.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the batch; cancelling remaining jobs");
            controller.cancelAll();
            return;
        }

        QueueDrainedEvent result = summary;
        LOG.info("Batch finished in {}: {} completed, {} failed, {} cancelled",
                TimeUtils.formatDuration(TimeUtils.elapsedMillis(startNanos)),
                result.completed(), result.failed(), result.cancelled());
    }

    @EventListener
    void onQueueDrained(QueueDrainedEvent event) {
        CountDownLatch latch = drained;
        if (latch != null) {
            summary = event;
            latch.countDown();
        }
    }

    @Override
    public int getExitCode() {
        QueueDrainedEvent result = summary;
        return result != null && (result.failed() > 0 || result.halted()) ? 1 : 0;
    }

    private static String requireSingleOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            if (OPTION_COVER.equals(name)) {
                throw new MissingCoverImageException();
            }
            throw new Audio2VideoException("Missing value for --" + name);
        }
        if (values.size() > 1) {
            throw new Audio2VideoException("Option --" + name + " given more than once");
        }
        return values.get(0);
    }
}
