package com.crowdsentinel.core.config;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;

/**
 * Physical calibration constants for the index normalizer, plus the time and
 * event sub-sections.
 *
 * <p>
 * Defaults follow the field prototype: comfortable heat index below 22,
 * stressful above 32; free-flow walking speed 1.2 m/s; critical density
 * 5 people/m².
 * </p>
 *
 * @since 1.0.0
 */
public class NormalizationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** TI and EI read the injected clock. */
    public static final String BASIS_WALL_CLOCK = "wall_clock";

    /** TI and EI read the sample's own timestamp (replays, backfills). */
    public static final String BASIS_SAMPLE = "sample";

    private double thiComfort = 22.0;
    private double thiDanger = 32.0;
    private double freeFlowSpeed = 1.2;
    private double criticalDensity = 5.0;
    private int volatilityWindow = 6;
    private double densityVolatilityScale = 0.5;
    private double speedVolatilityScale = 0.3;
    private String timeZone = "UTC";
    private String timeBasis = BASIS_WALL_CLOCK;
    private TimeIndexSettings time = new TimeIndexSettings();
    private EventIndexSettings event = new EventIndexSettings();

    void collectErrors(List<String> errors) {
        if (!(thiDanger > thiComfort)) {
            errors.add("normalization.thiDanger must be greater than thiComfort, got comfort="
                    + thiComfort + " danger=" + thiDanger);
        }
        if (!(freeFlowSpeed > 0)) {
            errors.add("normalization.freeFlowSpeed must be > 0, got: " + freeFlowSpeed);
        }
        if (!(criticalDensity > 0)) {
            errors.add("normalization.criticalDensity must be > 0, got: " + criticalDensity);
        }
        if (volatilityWindow < 2) {
            errors.add("normalization.volatilityWindow must be >= 2, got: " + volatilityWindow);
        }
        if (!(densityVolatilityScale > 0) || !(speedVolatilityScale > 0)) {
            errors.add("normalization volatility scales must be > 0");
        }
        if (timeZone == null) {
            errors.add("normalization.timeZone must not be null");
        } else {
            try {
                zoneId();
            } catch (DateTimeException e) {
                errors.add("normalization.timeZone is not a valid zone id: '" + timeZone + "'");
            }
        }
        if (!(BASIS_WALL_CLOCK.equals(timeBasis) || BASIS_SAMPLE.equals(timeBasis))) {
            errors.add("Unknown time basis: '" + timeBasis + "'. Supported: wall_clock, sample");
        }
        if (time == null) {
            errors.add("normalization.time is required");
        } else {
            time.collectErrors(errors);
        }
        if (event == null) {
            errors.add("normalization.event is required");
        } else {
            event.collectErrors(errors);
        }
    }

    /**
     * @return the configured zone
     * @throws DateTimeException if the zone id is invalid
     */
    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    /**
     * @return {@code true} if TI and EI use the sample timestamp
     */
    public boolean usesSampleTime() {
        return BASIS_SAMPLE.equals(timeBasis);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getThiComfort() {
        return thiComfort;
    }

    public void setThiComfort(double thiComfort) {
        this.thiComfort = thiComfort;
    }

    public double getThiDanger() {
        return thiDanger;
    }

    public void setThiDanger(double thiDanger) {
        this.thiDanger = thiDanger;
    }

    public double getFreeFlowSpeed() {
        return freeFlowSpeed;
    }

    public void setFreeFlowSpeed(double freeFlowSpeed) {
        this.freeFlowSpeed = freeFlowSpeed;
    }

    public double getCriticalDensity() {
        return criticalDensity;
    }

    public void setCriticalDensity(double criticalDensity) {
        this.criticalDensity = criticalDensity;
    }

    public int getVolatilityWindow() {
        return volatilityWindow;
    }

    public void setVolatilityWindow(int volatilityWindow) {
        this.volatilityWindow = volatilityWindow;
    }

    public double getDensityVolatilityScale() {
        return densityVolatilityScale;
    }

    public void setDensityVolatilityScale(double densityVolatilityScale) {
        this.densityVolatilityScale = densityVolatilityScale;
    }

    public double getSpeedVolatilityScale() {
        return speedVolatilityScale;
    }

    public void setSpeedVolatilityScale(double speedVolatilityScale) {
        this.speedVolatilityScale = speedVolatilityScale;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public String getTimeBasis() {
        return timeBasis;
    }

    public void setTimeBasis(String timeBasis) {
        this.timeBasis = timeBasis != null ? timeBasis.toLowerCase(Locale.ROOT) : null;
    }

    public TimeIndexSettings getTime() {
        return time;
    }

    public void setTime(TimeIndexSettings time) {
        this.time = time;
    }

    public EventIndexSettings getEvent() {
        return event;
    }

    public void setEvent(EventIndexSettings event) {
        this.event = event;
    }

    @Override
    public String toString() {
        return "NormalizationSettings{" +
                "thiComfort=" + thiComfort +
                ", thiDanger=" + thiDanger +
                ", freeFlowSpeed=" + freeFlowSpeed +
                ", criticalDensity=" + criticalDensity +
                ", volatilityWindow=" + volatilityWindow +
                ", timeZone='" + timeZone + '\'' +
                ", timeBasis='" + timeBasis + '\'' +
                ", time=" + time +
                ", event=" + event +
                '}';
    }
}
