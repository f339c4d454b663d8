package com.phillippitts.audio2video.util;

/**
 * Time conversion helpers shared by process supervision and logging.
 */
public final class TimeUtils {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds, truncating toward zero.
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds elapsed since a {@link System#nanoTime()} reading.
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * Formats a duration as {@code HH:MM:SS}; negative values format as {@code 00:00:00}.
     *
     * @param millis duration in milliseconds
     * @return formatted duration
     */
    public static String formatDuration(long millis) {
        if (millis < 0) {
            return "00:00:00";
        }
        long totalSeconds = millis / 1000;
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        return String.format("%02d:%02d:%02d", hours, minutes, seconds);
    }
}
