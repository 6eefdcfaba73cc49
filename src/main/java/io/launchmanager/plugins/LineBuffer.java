package io.launchmanager.plugins;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded buffer of the most recent output lines of one process.
 */
final class LineBuffer {
    static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<String> lines;
    private long total;

    LineBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.lines = new ArrayDeque<>(Math.min(capacity, 64));
    }

    synchronized void append(String line) {
        if (lines.size() == capacity) {
            lines.removeFirst();
        }
        lines.addLast(line);
        total++;
    }

    synchronized List<String> tail(int count) {
        List<String> all = new ArrayList<>(lines);
        int from = Math.max(0, all.size() - Math.max(0, count));
        return List.copyOf(all.subList(from, all.size()));
    }

    synchronized long totalLines() {
        return total;
    }
}
