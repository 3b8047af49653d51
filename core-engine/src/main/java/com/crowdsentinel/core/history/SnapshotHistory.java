package com.crowdsentinel.core.history;

import com.crowdsentinel.core.model.RiskSnapshot;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Bounded, ordered record of recent {@link RiskSnapshot}s.
 *
 * <p>
 * Backed by a circular array: once {@code capacity} snapshots are held, each
 * append evicts the oldest one. Not thread-safe; the owning engine serializes
 * writers and readers.
 * </p>
 *
 * @since 1.0.0
 */
public class SnapshotHistory implements Serializable {

    private static final long serialVersionUID = 1L;

    private final RiskSnapshot[] buffer;
    private int head;
    private int size;

    /**
     * @param capacity maximum number of retained snapshots; must be positive
     * @throws IllegalArgumentException if {@code capacity < 1}
     */
    public SnapshotHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be >= 1, got: " + capacity);
        }
        this.buffer = new RiskSnapshot[capacity];
    }

    public void append(RiskSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot must not be null");
        }
        int tail = (head + size) % buffer.length;
        buffer[tail] = snapshot;
        if (size < buffer.length) {
            size++;
        } else {
            head = (head + 1) % buffer.length;
        }
    }

    /**
     * Return up to {@code k} of the most recent snapshots, oldest first.
     *
     * @param k number of snapshots wanted; values above {@link #size()} return
     *          everything held
     * @return immutable list in ascending timestamp order
     * @throws IllegalArgumentException if {@code k} is negative
     */
    public List<RiskSnapshot> last(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be >= 0, got: " + k);
        }
        int count = Math.min(k, size);
        if (count == 0) {
            return Collections.emptyList();
        }
        List<RiskSnapshot> result = new ArrayList<>(count);
        int start = size - count;
        for (int i = start; i < size; i++) {
            result.add(buffer[(head + i) % buffer.length]);
        }
        return Collections.unmodifiableList(result);
    }

    public Optional<RiskSnapshot> latest() {
        if (size == 0) {
            return Optional.empty();
        }
        return Optional.of(buffer[(head + size - 1) % buffer.length]);
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return buffer.length;
    }
}
