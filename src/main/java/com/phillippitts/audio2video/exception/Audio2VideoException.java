package com.phillippitts.audio2video.exception;

/**
 * Base exception for all audio2video application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class Audio2VideoException extends RuntimeException {

    public Audio2VideoException(String message) {
        super(message);
    }

    public Audio2VideoException(String message, Throwable cause) {
        super(message, cause);
    }

    public Audio2VideoException(Throwable cause) {
        super(cause);
    }
}
