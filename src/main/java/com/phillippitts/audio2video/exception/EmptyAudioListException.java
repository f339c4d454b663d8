package com.phillippitts.audio2video.exception;

/**
 * Thrown by {@code start()} when no audio file has been submitted.
 */
public class EmptyAudioListException extends Audio2VideoException {

    public EmptyAudioListException() {
        super("No audio files to convert");
    }
}
