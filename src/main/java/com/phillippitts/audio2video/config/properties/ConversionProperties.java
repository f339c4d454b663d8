package com.phillippitts.audio2video.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Batch conversion settings.
 *
 * <p>Properties:
 * <ul>
 *   <li>conversion.concurrency - Maximum jobs encoding at once (default: 1, strictly sequential)</li>
 *   <li>conversion.cancel-grace-period-ms - Wait after a termination request before killing the encoder (default: 5000)</li>
 *   <li>conversion.log-tail-lines - Encoder diagnostic lines kept per job (default: 20)</li>
 *   <li>conversion.output-directory - Default destination folder (default: ~/Desktop/Audio2Video_Exports)</li>
 *   <li>conversion.thread-name-prefix - Worker thread name prefix (default: conversion-)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "conversion")
@Validated
public class ConversionProperties {

    public static final String DEFAULT_OUTPUT_FOLDER_NAME = "Audio2Video_Exports";

    /** Maximum jobs running simultaneously. */
    @Positive(message = "Concurrency must be positive")
    private int concurrency = 1;

    /** Grace period between the cooperative termination request and the forced kill. */
    @Positive(message = "Cancel grace period must be positive")
    private long cancelGracePeriodMs = 5000;

    /** Capacity of each job's diagnostic ring buffer. */
    @Positive(message = "Log tail size must be positive")
    private int logTailLines = 20;

    /** Destination folder used when the collaborator does not choose one. */
    private String outputDirectory;

    @NotBlank
    private String threadNamePrefix = "conversion-";

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public long getCancelGracePeriodMs() {
        return cancelGracePeriodMs;
    }

    public void setCancelGracePeriodMs(long cancelGracePeriodMs) {
        this.cancelGracePeriodMs = cancelGracePeriodMs;
    }

    public int getLogTailLines() {
        return logTailLines;
    }

    public void setLogTailLines(int logTailLines) {
        this.logTailLines = logTailLines;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    /**
     * Configured output directory, or {@code <home>/Desktop/Audio2Video_Exports} when unset.
     */
    public Path resolveOutputDirectory() {
        if (outputDirectory != null && !outputDirectory.isBlank()) {
            return Path.of(outputDirectory).toAbsolutePath().normalize();
        }
        return Path.of(System.getProperty("user.home"), "Desktop", DEFAULT_OUTPUT_FOLDER_NAME);
    }
}
