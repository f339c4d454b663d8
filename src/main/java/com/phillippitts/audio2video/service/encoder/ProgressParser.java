package com.phillippitts.audio2video.service.encoder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Decodes the encoder's {@code -progress} output into {@link ProgressSnapshot}s.
 *
 * <p>The stream is a sequence of {@code key=value} lines. A frame ends with
 * {@code progress=continue} or {@code progress=end}; the parser accumulates pairs until
 * that sentinel and then emits one snapshot. Lines without {@code =} are ignored.
 *
 * <p>Elapsed time is read from the first usable key among {@code out_time_us},
 * {@code out_time_ms} and {@code out_time}. Despite its name, {@code out_time_ms} carries
 * microseconds. {@code N/A} and negative values read as 0.
 *
 * <p>Not thread-safe: one parser per job, fed by the single stdout reader.
 */
public final class ProgressParser {

    private static final Logger LOG = LogManager.getLogger(ProgressParser.class);

    static final String KEY_PROGRESS = "progress";
    static final String KEY_OUT_TIME_US = "out_time_us";
    static final String KEY_OUT_TIME_MS = "out_time_ms";
    static final String KEY_OUT_TIME = "out_time";
    static final String VALUE_END = "end";

    private static final Pattern CLOCK = Pattern.compile("^(-?)(\\d+):(\\d{1,2}):(\\d{1,2})(?:\\.(\\d+))?$");

    private final Map<String, String> pending = new LinkedHashMap<>();
    private boolean ended;
    private long frames;

    /**
     * Feeds one line of the progress stream.
     *
     * @param line raw line, with or without surrounding whitespace
     * @return a snapshot when {@code line} closes a frame, otherwise empty
     */
    public Optional<ProgressSnapshot> accept(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.strip();
        int eq = trimmed.indexOf('=');
        if (eq <= 0) {
            if (!trimmed.isEmpty()) {
                LOG.trace("Ignoring malformed progress line: {}", trimmed);
            }
            return Optional.empty();
        }
        String key = trimmed.substring(0, eq).strip();
        String value = trimmed.substring(eq + 1).strip();
        if (!KEY_PROGRESS.equals(key)) {
            pending.put(key, value);
            return Optional.empty();
        }

        boolean last = VALUE_END.equals(value);
        ProgressSnapshot snapshot = new ProgressSnapshot(
                elapsedMillis(pending),
                parseLong(pending.get("frame")),
                parseDouble(pending.get("fps")),
                normalize(pending.get("speed")),
                parseLong(pending.get("total_size")),
                last,
                pending);
        pending.clear();
        frames++;
        if (last) {
            ended = true;
        }
        return Optional.of(snapshot);
    }

    /**
     * Whether a {@code progress=end} frame has been seen.
     */
    public boolean hasEnded() {
        return ended;
    }

    public long frameCount() {
        return frames;
    }

    /**
     * Discards buffered pairs and the end marker.
     */
    public void reset() {
        pending.clear();
        ended = false;
        frames = 0;
    }

    /**
     * Lazily parses {@code reader} into snapshots.
     *
     * <p>The stream is finite: it ends after the {@code progress=end} frame or when the reader
     * reaches EOF. A trailing partial frame is dropped. Read failures surface as
     * {@link UncheckedIOException}. The reader is not closed.
     *
     * @param reader encoder stdout
     * @return snapshots in arrival order
     */
    public static Stream<ProgressSnapshot> snapshots(BufferedReader reader) {
        Objects.requireNonNull(reader, "reader");
        ProgressParser parser = new ProgressParser();
        Spliterator<ProgressSnapshot> spliterator = new Spliterators.AbstractSpliterator<>(
                Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super ProgressSnapshot> action) {
                if (parser.hasEnded()) {
                    return false;
                }
                try {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        Optional<ProgressSnapshot> snapshot = parser.accept(line);
                        if (snapshot.isPresent()) {
                            action.accept(snapshot.get());
                            return true;
                        }
                    }
                    return false;
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        };
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * Elapsed output time from a frame's pairs, in milliseconds.
     */
    static long elapsedMillis(Map<String, String> pairs) {
        long micros = parseMicros(pairs.get(KEY_OUT_TIME_US));
        if (micros < 0) {
            micros = parseMicros(pairs.get(KEY_OUT_TIME_MS));
        }
        if (micros < 0) {
            micros = parseClockMicros(pairs.get(KEY_OUT_TIME));
        }
        return micros < 0 ? 0L : micros / 1000L;
    }

    // -1 means "absent or unusable": caller falls through to the next key
    private static long parseMicros(String value) {
        long v = parseLong(value);
        return v < 0 ? -1L : v;
    }

    static long parseClockMicros(String value) {
        if (value == null) {
            return -1L;
        }
        Matcher m = CLOCK.matcher(value.strip());
        if (!m.matches() || !m.group(1).isEmpty()) {
            return -1L;
        }
        try {
            long hours = Long.parseLong(m.group(2));
            long minutes = Long.parseLong(m.group(3));
            long seconds = Long.parseLong(m.group(4));
            String frac = m.group(5) == null ? "" : m.group(5);
            String micros = (frac + "000000").substring(0, 6);
            return ((hours * 3600 + minutes * 60 + seconds) * 1_000_000L) + Long.parseLong(micros);
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    private static long parseLong(String value) {
        String v = normalize(value);
        if (v == null) {
            return -1L;
        }
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    private static double parseDouble(String value) {
        String v = normalize(value);
        if (v == null) {
            return -1.0;
        }
        try {
            double d = Double.parseDouble(v);
            return Double.isNaN(d) || d < 0 ? -1.0 : d;
        } catch (NumberFormatException e) {
            return -1.0;
        }
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String v = value.strip();
        return v.isEmpty() || "N/A".equalsIgnoreCase(v) ? null : v;
    }
}
