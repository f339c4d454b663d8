package com.phillippitts.audio2video.config.encoder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the ffmpeg and ffprobe executables.
 *
 * <p>Lookup order for each tool:
 * <ol>
 *   <li>the configured value, when it names an existing file (relative values are resolved
 *       against the working directory)</li>
 *   <li>the bundled copy in {@code bin/} under the working directory ({@code .exe} on Windows)</li>
 *   <li>the first executable match on {@code PATH}</li>
 * </ol>
 * When nothing matches, the configured value is returned unchanged so that spawning fails with
 * a launch error naming what the user configured.
 */
@Component
public class EncoderBinaryLocator {

    private static final Logger LOG = LogManager.getLogger(EncoderBinaryLocator.class);

    private final EncoderConfig config;
    private final Path workingDir;
    private final String searchPath;
    private final boolean windows;

    @Autowired
    public EncoderBinaryLocator(EncoderConfig config) {
        this(config,
                Path.of(".").toAbsolutePath().normalize(),
                System.getenv("PATH"),
                System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"));
    }

    EncoderBinaryLocator(EncoderConfig config, Path workingDir, String searchPath, boolean windows) {
        this.config = Objects.requireNonNull(config, "config");
        this.workingDir = Objects.requireNonNull(workingDir, "workingDir");
        this.searchPath = searchPath == null ? "" : searchPath;
        this.windows = windows;
    }

    public Path ffmpeg() {
        return locate(config.ffmpegPath(), "ffmpeg");
    }

    public Path ffprobe() {
        return locate(config.ffprobePath(), "ffprobe");
    }

    /**
     * Whether the path names an existing executable file.
     */
    public static boolean isExecutable(Path binary) {
        return binary != null && Files.isRegularFile(binary) && Files.isExecutable(binary);
    }

    Path locate(String configured, String toolName) {
        Optional<Path> explicit = explicitPath(configured);
        if (explicit.isPresent() && Files.isRegularFile(explicit.get())) {
            return explicit.get();
        }

        Path bundled = workingDir.resolve("bin").resolve(executableName(toolName));
        if (Files.isRegularFile(bundled)) {
            return bundled;
        }

        String lookupName = explicit.isPresent() ? explicit.get().getFileName().toString() : configured;
        Optional<Path> onPath = searchOnPath(lookupName);
        if (onPath.isPresent()) {
            return onPath.get();
        }

        LOG.debug("{} not found (configured='{}', bundled='{}'); using configured value", toolName, configured,
                bundled);
        return explicit.orElseGet(() -> Path.of(configured));
    }

    /**
     * Values containing a directory separator are treated as file paths; bare names are not.
     */
    private Optional<Path> explicitPath(String configured) {
        if (configured.indexOf('/') < 0 && configured.indexOf('\\') < 0) {
            return Optional.empty();
        }
        try {
            Path path = Path.of(configured);
            return Optional.of(path.isAbsolute() ? path : workingDir.resolve(path).normalize());
        } catch (InvalidPathException e) {
            LOG.warn("Ignoring invalid encoder path '{}': {}", configured, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Path> searchOnPath(String name) {
        String candidateName = executableName(name);
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            try {
                Path candidate = Path.of(dir).resolve(candidateName);
                if (isExecutable(candidate)) {
                    return Optional.of(candidate.toAbsolutePath());
                }
            } catch (InvalidPathException e) {
                LOG.debug("Skipping invalid PATH entry '{}'", dir);
            }
        }
        return Optional.empty();
    }

    private String executableName(String name) {
        if (windows && !name.toLowerCase(Locale.ROOT).endsWith(".exe")) {
            return name + ".exe";
        }
        return name;
    }
}
