package com.crowdsentinel.core.config;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Event calendar for the Event Index.
 *
 * <pre>
 * event:
 *   baseline: 0.2
 *   calendar:
 *     - name: shahi-snan
 *       start: "2028-04-22T03:00"
 *       end:   "2028-04-22T11:00"
 *       intensity: 0.9
 * </pre>
 *
 * <p>
 * Calendar times are local date-times in the configured time zone. Outside
 * every calendar entry the Event Index equals {@code baseline}.
 * </p>
 *
 * @since 1.0.0
 */
public class EventIndexSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double baseline = 0.2;
    private List<CalendarEvent> calendar = new ArrayList<>();

    void collectErrors(List<String> errors) {
        if (!(baseline >= 0 && baseline <= 1)) {
            errors.add("event.baseline must be in [0,1], got: " + baseline);
        }
        for (int i = 0; i < calendar.size(); i++) {
            CalendarEvent e = calendar.get(i);
            if (e == null) {
                errors.add("Calendar event at index " + i + " is null");
                continue;
            }
            String label = e.getName() != null ? "'" + e.getName() + "'" : "at index " + i;
            if (e.getStart() == null || e.getEnd() == null) {
                errors.add("Calendar event " + label + " requires both start and end");
            } else {
                try {
                    if (!e.startTime().isBefore(e.endTime())) {
                        errors.add("Calendar event " + label + " must start before it ends");
                    }
                } catch (DateTimeParseException ex) {
                    errors.add("Calendar event " + label + " must use ISO local date-times, got: "
                            + e.getStart() + " / " + e.getEnd());
                }
            }
            if (!(e.getIntensity() >= 0 && e.getIntensity() <= 1)) {
                errors.add("Calendar event " + label + " intensity must be in [0,1], got: " + e.getIntensity());
            }
        }
    }

    public double getBaseline() {
        return baseline;
    }

    public void setBaseline(double baseline) {
        this.baseline = baseline;
    }

    /**
     * @return unmodifiable list of calendar events
     */
    public List<CalendarEvent> getCalendar() {
        return Collections.unmodifiableList(calendar);
    }

    public void setCalendar(List<CalendarEvent> calendar) {
        this.calendar = calendar != null ? new ArrayList<>(calendar) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "EventIndexSettings{baseline=" + baseline + ", calendar=" + calendar + '}';
    }

    /**
     * A scheduled ritual, procession or other surge event.
     */
    public static class CalendarEvent implements Serializable {

        private static final long serialVersionUID = 1L;

        private String name;
        private String start;
        private String end;
        private double intensity;

        /** No-arg constructor required by SnakeYAML. */
        public CalendarEvent() {
        }

        public CalendarEvent(String name, String start, String end, double intensity) {
            this.name = name;
            this.start = start;
            this.end = end;
            this.intensity = intensity;
        }

        public LocalDateTime startTime() {
            return LocalDateTime.parse(start);
        }

        public LocalDateTime endTime() {
            return LocalDateTime.parse(end);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
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

        public double getIntensity() {
            return intensity;
        }

        public void setIntensity(double intensity) {
            this.intensity = intensity;
        }

        @Override
        public String toString() {
            return name + "[" + start + " → " + end + ", " + intensity + "]";
        }
    }
}
