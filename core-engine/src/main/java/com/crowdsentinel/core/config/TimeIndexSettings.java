package com.crowdsentinel.core.config;

import java.io.Serializable;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Peak windows for the Time Index.
 *
 * <pre>
 * time:
 *   base: 0.1
 *   peak: 0.9
 *   shoulderMinutes: 60
 *   peakWindows:
 *     - { start: "06:00", end: "10:00" }
 * </pre>
 *
 * <p>
 * Windows are local {@code HH:mm} ranges, start inclusive and end exclusive;
 * a window whose end is before its start wraps past midnight. The defaults
 * are the pre-dawn, morning bathing and evening procession hours.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeIndexSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double base = 0.1;
    private double peak = 0.9;
    private int shoulderMinutes = 60;
    private List<PeakWindow> peakWindows = new ArrayList<>(List.of(
            new PeakWindow("03:00", "06:00"),
            new PeakWindow("06:00", "10:00"),
            new PeakWindow("17:00", "20:00")));

    void collectErrors(List<String> errors) {
        if (!(base >= 0 && base <= peak && peak <= 1.0)) {
            errors.add("time index requires 0 <= base <= peak <= 1, got base=" + base + " peak=" + peak);
        }
        if (shoulderMinutes < 0) {
            errors.add("time.shoulderMinutes must be >= 0, got: " + shoulderMinutes);
        }
        for (int i = 0; i < peakWindows.size(); i++) {
            PeakWindow w = peakWindows.get(i);
            if (w == null) {
                errors.add("Peak window at index " + i + " is null");
                continue;
            }
            if (w.getStart() == null || w.getEnd() == null) {
                errors.add("Peak window at index " + i + " requires both start and end");
                continue;
            }
            try {
                if (w.startTime().equals(w.endTime())) {
                    errors.add("Peak window at index " + i + " is empty: " + w);
                }
            } catch (DateTimeParseException e) {
                errors.add("Peak window at index " + i + " must use HH:mm times, got: " + w);
            }
        }
    }

    public double getBase() {
        return base;
    }

    public void setBase(double base) {
        this.base = base;
    }

    public double getPeak() {
        return peak;
    }

    public void setPeak(double peak) {
        this.peak = peak;
    }

    public int getShoulderMinutes() {
        return shoulderMinutes;
    }

    public void setShoulderMinutes(int shoulderMinutes) {
        this.shoulderMinutes = shoulderMinutes;
    }

    /**
     * @return unmodifiable list of peak windows
     */
    public List<PeakWindow> getPeakWindows() {
        return Collections.unmodifiableList(peakWindows);
    }

    public void setPeakWindows(List<PeakWindow> peakWindows) {
        this.peakWindows = peakWindows != null ? new ArrayList<>(peakWindows) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "TimeIndexSettings{base=" + base + ", peak=" + peak
                + ", shoulderMinutes=" + shoulderMinutes + ", peakWindows=" + peakWindows + '}';
    }

    /**
     * A daily high-risk window.
     */
    public static class PeakWindow implements Serializable {

        private static final long serialVersionUID = 1L;

        private String start;
        private String end;

        /** No-arg constructor required by SnakeYAML. */
        public PeakWindow() {
        }

        public PeakWindow(String start, String end) {
            this.start = start;
            this.end = end;
        }

        public LocalTime startTime() {
            return LocalTime.parse(start);
        }

        public LocalTime endTime() {
            return LocalTime.parse(end);
        }

        public String getStart() {
            return start;
        }

        public void setStart(String start) {
            this.start = start;
        }

        public String getEnd() {
            return end;
        }

        public void setEnd(String end) {
            this.end = end;
        }

        @Override
        public String toString() {
            return start + "-" + end;
        }
    }
}
