package com.phillippitts.audio2video.service.encoder;

import com.phillippitts.audio2video.exception.ConversionErrorKind;
import com.phillippitts.audio2video.exception.ConversionException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of one encode.
 *
 * @param status how the encode ended
 * @param failure cause when {@code status} is {@link Status#FAILED}, otherwise {@code null}
 * @param durationMs wall-clock time from spawn to outcome
 */
public record EncodeOutcome(Status status, ConversionException failure, long durationMs) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        CANCELLED
    }

    public EncodeOutcome {
        Objects.requireNonNull(status, "status");
        if ((status == Status.FAILED) != (failure != null)) {
            throw new IllegalArgumentException("failure must be present exactly when status is FAILED");
        }
    }

    public static EncodeOutcome succeeded(long durationMs) {
        return new EncodeOutcome(Status.SUCCEEDED, null, durationMs);
    }

    public static EncodeOutcome cancelled(long durationMs) {
        return new EncodeOutcome(Status.CANCELLED, null, durationMs);
    }

    public static EncodeOutcome failed(ConversionException failure, long durationMs) {
        return new EncodeOutcome(Status.FAILED, Objects.requireNonNull(failure, "failure"), durationMs);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public Optional<ConversionErrorKind> errorKind() {
        return failure == null ? Optional.empty() : Optional.of(failure.getKind());
    }

    public List<String> logTail() {
        return failure == null ? List.of() : failure.getLogTail();
    }
}
