package com.crowdsentinel.core.normalize;

import com.crowdsentinel.core.config.EventIndexSettings;

import java.io.Serializable;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scheduled surge events, resolved to absolute instants.
 *
 * <p>
 * The event intensity at an instant is the highest intensity among the
 * events active at that instant (start inclusive, end exclusive), or the
 * baseline when none is active.
 * </p>
 *
 * @since 1.0.0
 */
public class EventCalendar implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double baseline;
    private final List<Entry> entries;

    /**
     * @param settings validated event settings; must not be {@code null}
     * @param zone     zone in which calendar date-times are expressed
     */
    public EventCalendar(EventIndexSettings settings, ZoneId zone) {
        Objects.requireNonNull(settings, "EventIndexSettings must not be null");
        Objects.requireNonNull(zone, "ZoneId must not be null");
        this.baseline = settings.getBaseline();
        List<Entry> resolved = new ArrayList<>();
        for (EventIndexSettings.CalendarEvent e : settings.getCalendar()) {
            resolved.add(new Entry(
                    e.startTime().atZone(zone).toInstant(),
                    e.endTime().atZone(zone).toInstant(),
                    e.getIntensity()));
        }
        this.entries = List.copyOf(resolved);
    }

    /**
     * @param at reference instant
     * @return event intensity in [0,1]
     */
    public double intensityAt(Instant at) {
        double intensity = -1;
        for (Entry entry : entries) {
            if (!at.isBefore(entry.start) && at.isBefore(entry.end)) {
                intensity = Math.max(intensity, entry.intensity);
            }
        }
        return intensity < 0 ? baseline : intensity;
    }

    private static final class Entry implements Serializable {

        private static final long serialVersionUID = 1L;

        private final Instant start;
        private final Instant end;
        private final double intensity;

        private Entry(Instant start, Instant end, double intensity) {
            this.start = start;
            this.end = end;
            this.intensity = intensity;
        }
    }
}
