package com.phillippitts.linkband.service.monitor;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Bounded ring buffer of recorded statuses, oldest first.
 *
 * <p>Not thread-safe; owned by {@link ConnectionMonitor}.
 */
public final class StatusHistory {

    /**
     * @param status recorded observation
     * @param recordedAt local time of the record
     */
    public record Entry(ConnectionStatus status, Instant recordedAt) {
    }

    private final int capacity;
    private final Deque<Entry> entries;

    public StatusHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    /** Appends an entry, evicting the oldest when full. */
    public void add(ConnectionStatus status, Instant recordedAt) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(new Entry(status, recordedAt));
    }

    public ConnectionStatus latest() {
        Entry last = entries.peekLast();
        return last == null ? null : last.status();
    }

    /** Up to {@code limit} newest statuses, oldest first; all of them when {@code limit <= 0}. */
    public List<ConnectionStatus> latest(int limit) {
        int n = limit <= 0 ? entries.size() : Math.min(limit, entries.size());
        List<ConnectionStatus> out = new ArrayList<>(n);
        int skip = entries.size() - n;
        for (Entry e : entries) {
            if (skip-- > 0) {
                continue;
            }
            out.add(e.status());
        }
        return List.copyOf(out);
    }

    /** Counts matches among the {@code window} newest statuses. */
    public int countRecent(int window, Predicate<ConnectionStatus> predicate) {
        int count = 0;
        int seen = 0;
        Iterator<Entry> it = entries.descendingIterator();
        while (it.hasNext() && seen < window) {
            if (predicate.test(it.next().status())) {
                count++;
            }
            seen++;
        }
        return count;
    }

    /**
     * Removes entries recorded at or before {@code cutoff}.
     *
     * @return number of entries removed
     */
    public int pruneOlderThan(Instant cutoff) {
        int before = entries.size();
        entries.removeIf(e -> !e.recordedAt().isAfter(cutoff));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
