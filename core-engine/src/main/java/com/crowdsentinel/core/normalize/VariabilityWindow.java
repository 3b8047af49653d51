package com.crowdsentinel.core.normalize;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Sliding window of recent density and speed readings used to measure crowd
 * volatility.
 *
 * <p>
 * Keeps the last {@code capacity} readings; the oldest is evicted first.
 * Volatility is the mean absolute change between consecutive readings.
 * </p>
 *
 * @since 1.0.0
 */
public class VariabilityWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int capacity;
    private final Deque<double[]> readings = new ArrayDeque<>();

    /**
     * @param capacity number of readings to keep; must be at least 2
     * @throws IllegalArgumentException if {@code capacity < 2}
     */
    public VariabilityWindow(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("Variability window capacity must be >= 2, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Record a reading, evicting the oldest if the window is full.
     */
    public void add(double density, double speed) {
        readings.addLast(new double[] { density, speed });
        if (readings.size() > capacity) {
            readings.pollFirst();
        }
    }

    public int size() {
        return readings.size();
    }

    /**
     * @return {@code true} once at least two readings are available
     */
    public boolean hasSignal() {
        return readings.size() >= 2;
    }

    /**
     * @return mean absolute density change between consecutive readings, 0
     *         with fewer than two readings
     */
    public double meanAbsDensityChange() {
        return meanAbsChange(0);
    }

    /**
     * @return mean absolute speed change between consecutive readings, 0 with
     *         fewer than two readings
     */
    public double meanAbsSpeedChange() {
        return meanAbsChange(1);
    }

    private double meanAbsChange(int column) {
        if (!hasSignal()) {
            return 0.0;
        }
        Iterator<double[]> it = readings.iterator();
        double previous = it.next()[column];
        double total = 0;
        while (it.hasNext()) {
            double current = it.next()[column];
            total += Math.abs(current - previous);
            previous = current;
        }
        return total / (readings.size() - 1);
    }
}
