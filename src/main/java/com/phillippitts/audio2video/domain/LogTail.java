package com.phillippitts.audio2video.domain;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded ring buffer of the most recent diagnostic lines written by the encoder.
 *
 * <p>When full, appending drops the oldest line. Safe for one writer (the stderr reader
 * thread) and any number of readers.
 */
public final class LogTail {

    private final int capacity;
    private final Deque<String> lines;
    private final Lock lock = new ReentrantLock();

    public LogTail(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.lines = new ArrayDeque<>(capacity);
    }

    public void append(String line) {
        if (line == null) {
            return;
        }
        lock.lock();
        try {
            if (lines.size() == capacity) {
                lines.removeFirst();
            }
            lines.addLast(line);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an immutable copy of the buffered lines, oldest first.
     */
    public List<String> lines() {
        lock.lock();
        try {
            return List.copyOf(lines);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            lines.clear();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return lines.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Joins the buffered lines with newlines.
     */
    @Override
    public String toString() {
        return String.join("\n", lines());
    }
}
