package com.phillippitts.audio2video.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * File-extension checks for the inputs a batch accepts.
 *
 * <p>Some video containers are listed as audio sources because the encoder only reads
 * their audio track.
 */
public final class MediaFileTypes {

    public static final Set<String> AUDIO_EXTENSIONS = Set.of(
            "m4a", "mp3", "wav", "aac", "flac", "ogg", "wma", "opus",
            "aiff", "aif", "mp2", "mp4", "webm", "mkv", "avi");

    public static final Set<String> IMAGE_EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "bmp", "gif", "webp", "tiff", "tif");

    private MediaFileTypes() {
        // Utility class - prevent instantiation
    }

    public static boolean isSupportedAudio(Path path) {
        return AUDIO_EXTENSIONS.contains(extensionOf(path));
    }

    public static boolean isSupportedImage(Path path) {
        return IMAGE_EXTENSIONS.contains(extensionOf(path));
    }

    /**
     * Lower-case extension without the dot, or "" when the name has none.
     */
    public static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
