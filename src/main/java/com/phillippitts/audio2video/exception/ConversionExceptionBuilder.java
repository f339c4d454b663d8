package com.phillippitts.audio2video.exception;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for constructing {@link ConversionException} with contextual details.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Simple exception
 * throw ConversionExceptionBuilder.create(ConversionErrorKind.INPUT_MISSING, "Audio file not found")
 *         .metadata("audio", audioPath)
 *         .build();
 *
 * // Encoder failure with exit code and diagnostics
 * throw ConversionExceptionBuilder.create(ConversionErrorKind.ENCODER_EXITED_NON_ZERO, "Encoder failed")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .logTail(tailLines)
 *         .metadata("output", outputPath)
 *         .build();
 * </pre>
 */
public final class ConversionExceptionBuilder {

    private final ConversionErrorKind kind;
    private final String message;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final List<String> logTail = new ArrayList<>();
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ConversionExceptionBuilder(ConversionErrorKind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    /**
     * Creates a new builder with the error kind and base message.
     *
     * @param kind error classification (must not be null)
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ConversionExceptionBuilder create(ConversionErrorKind kind, String message) {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ConversionExceptionBuilder(kind, message);
    }

    public ConversionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ConversionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ConversionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Attaches the encoder's most recent diagnostic lines.
     *
     * @param lines diagnostic lines, oldest first (null is ignored)
     * @return this builder for chaining
     */
    public ConversionExceptionBuilder logTail(List<String> lines) {
        if (lines != null) {
            this.logTail.addAll(lines);
        }
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ConversionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed ConversionException
     */
    public ConversionException build() {
        return new ConversionException(kind, buildDetailedMessage(), exitCode, logTail, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }

        sb.append(')');
        return sb.toString();
    }
}
