package com.phillippitts.audio2video.exception;

/**
 * Thrown by {@code start()} when no cover image was selected, or the selected one does not exist.
 */
public class MissingCoverImageException extends Audio2VideoException {

    private final String coverPath;

    public MissingCoverImageException() {
        super("No cover image selected");
        this.coverPath = null;
    }

    public MissingCoverImageException(String coverPath) {
        super("Cover image not found: " + coverPath);
        this.coverPath = coverPath;
    }

    /**
     * Path that was selected but missing, or {@code null} if none was selected at all.
     */
    public String getCoverPath() {
        return coverPath;
    }
}
