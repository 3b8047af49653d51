package com.crowdsentinel.core.normalize;

import com.crowdsentinel.core.config.NormalizationSettings;
import com.crowdsentinel.core.config.TimeIndexSettings;
import com.crowdsentinel.core.model.IndexSet;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

import static com.crowdsentinel.core.model.IndexSet.clamp01;

/**
 * Maps sanitized sensor readings to dimensionless indices in [0,1].
 *
 * <p>
 * All methods are pure: the normalizer holds only immutable calibration
 * values. Crowd volatility and the reference instant for the time and event
 * indices are supplied by the caller, so a fixed input always yields the
 * same {@link IndexSet}.
 * </p>
 *
 * <h3>Formulas</h3>
 * <ul>
 * <li>THI: {@code T − (0.55 − 0.0055·RH)·(T − 14.5)}, rescaled from
 * [comfort, danger]</li>
 * <li>CDI: {@code d·(0.5 + 0.5·c)} with {@code d} density over critical
 * density and {@code c} congestion (1 − speed / free-flow speed)</li>
 * <li>CAI: volatility (or the anxiety-signal blend) plus
 * {@code 0.25·densityLevel}</li>
 * <li>TI: base to peak by proximity to the nearest peak window</li>
 * <li>EI: calendar intensity or baseline</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class IndexNormalizer implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final int MINUTES_PER_DAY = 24 * 60;

    /** Share of CAI contributed by the density level. */
    static final double CAI_DENSITY_AMPLIFIER = 0.25;

    private final double thiComfort;
    private final double thiDanger;
    private final double freeFlowSpeed;
    private final double criticalDensity;
    private final double densityVolatilityScale;
    private final double speedVolatilityScale;
    private final double timeBase;
    private final double timePeak;
    private final int shoulderMinutes;
    /** Peak windows as {startMinute, endMinute} pairs. */
    private final List<int[]> peakWindows;
    private final ZoneId zone;
    private final EventCalendar calendar;

    /**
     * @param settings validated normalization settings; must not be
     *                 {@code null}
     */
    public IndexNormalizer(NormalizationSettings settings) {
        Objects.requireNonNull(settings, "NormalizationSettings must not be null");
        this.thiComfort = settings.getThiComfort();
        this.thiDanger = settings.getThiDanger();
        this.freeFlowSpeed = settings.getFreeFlowSpeed();
        this.criticalDensity = settings.getCriticalDensity();
        this.densityVolatilityScale = settings.getDensityVolatilityScale();
        this.speedVolatilityScale = settings.getSpeedVolatilityScale();
        this.timeBase = settings.getTime().getBase();
        this.timePeak = settings.getTime().getPeak();
        this.shoulderMinutes = settings.getTime().getShoulderMinutes();
        List<int[]> windows = new ArrayList<>();
        for (TimeIndexSettings.PeakWindow w : settings.getTime().getPeakWindows()) {
            windows.add(new int[] { minuteOfDay(w.startTime()), minuteOfDay(w.endTime()) });
        }
        this.peakWindows = windows;
        this.zone = settings.zoneId();
        this.calendar = new EventCalendar(settings.getEvent(), zone);
    }

    // ---------------------------------------------------------------
    // Full index set
    // ---------------------------------------------------------------

    /**
     * Compute every index for one reading.
     *
     * @param reading   sanitized reading; must not be {@code null}
     * @param window    recent density/speed history, current reading included
     * @param reference instant used for the time and event indices
     * @return the index set
     */
    public IndexSet normalize(SensorReading reading, VariabilityWindow window, Instant reference) {
        Objects.requireNonNull(reading, "SensorReading must not be null");
        Objects.requireNonNull(window, "VariabilityWindow must not be null");
        Objects.requireNonNull(reference, "Reference instant must not be null");

        double density = reading.getDensity();
        double speed = reading.getSpeed();

        return new IndexSet(
                cai(density, speed, window, anxietyProxy(reading)),
                cdi(density, speed),
                thi(reading.getTemperature(), reading.getHumidity()),
                timeIndex(LocalTime.ofInstant(reference, zone)),
                eventIndex(reference),
                reading.getAttitude(),
                reading.getSubjectiveNorm(),
                reading.getPerceivedControl());
    }

    // ---------------------------------------------------------------
    // Heat stress
    // ---------------------------------------------------------------

    /**
     * Temperature-humidity index in Celsius-like units (typically 15..40).
     *
     * @param temperature air temperature in °C
     * @param humidity    relative humidity in percent
     */
    public static double rawThi(double temperature, double humidity) {
        return temperature - (0.55 - 0.0055 * humidity) * (temperature - 14.5);
    }

    public double thi(double temperature, double humidity) {
        return clamp01((rawThi(temperature, humidity) - thiComfort) / (thiDanger - thiComfort));
    }

    // ---------------------------------------------------------------
    // Crowd dynamics
    // ---------------------------------------------------------------

    /**
     * Fruin-style density level: below 1 p/m² low, 1 to 2 moderate, 2 to 3.5 high,
     * above 3.5 severe, saturating at 5 p/m².
     *
     * @param density people per m²
     * @return level in [0,1]
     */
    public static double densityLevel(double density) {
        double p = Math.max(0.0, density);
        if (p <= 1.0) {
            return 0.15 * p;
        }
        if (p <= 2.0) {
            return 0.15 + 0.25 * (p - 1.0);
        }
        if (p <= 3.5) {
            return 0.40 + 0.35 * ((p - 2.0) / 1.5);
        }
        return 0.75 + 0.25 * Math.min(1.0, (p - 3.5) / 1.5);
    }

    /**
     * @param speed mean crowd speed in m/s
     * @return 0 at or above free-flow speed, 1 when stalled
     */
    public double congestion(double speed) {
        return 1.0 - clamp01(speed / freeFlowSpeed);
    }

    public double cdi(double density, double speed) {
        double d = clamp01(density / criticalDensity);
        return clamp01(d * (0.5 + 0.5 * congestion(speed)));
    }

    // ---------------------------------------------------------------
    // Crowd anxiety
    // ---------------------------------------------------------------

    /**
     * Volatility of the crowd over the window. Falls back to
     * {@code densityLevel · congestion} until two readings are available.
     */
    public double volatility(double density, double speed, VariabilityWindow window) {
        if (!window.hasSignal()) {
            return clamp01(densityLevel(density) * congestion(speed));
        }
        double densityTerm = clamp01(window.meanAbsDensityChange() / densityVolatilityScale);
        double speedTerm = clamp01(window.meanAbsSpeedChange() / speedVolatilityScale);
        return 0.5 * densityTerm + 0.5 * speedTerm;
    }

    /**
     * Anxiety proxy from discrete CCTV signals. Missing signals count as 0.
     *
     * @return the proxy, or empty when the reading carries no signal at all
     */
    public static OptionalDouble anxietyProxy(SensorReading reading) {
        if (!reading.hasAnxietySignals()) {
            return OptionalDouble.empty();
        }
        double push = clamp01(valueOrZero(reading.getPushRate()) / 10.0);
        double shout = clamp01(valueOrZero(reading.getShoutRate()) / 20.0);
        double falls = clamp01(valueOrZero(reading.getNearFalls()) / 10.0);
        return OptionalDouble.of(clamp01(0.4 * push + 0.3 * shout + 0.3 * falls));
    }

    public double cai(double density, double speed, VariabilityWindow window, OptionalDouble anxiety) {
        double volatility = volatility(density, speed, window);
        double base = anxiety.isPresent() ? 0.5 * volatility + 0.5 * anxiety.getAsDouble() : volatility;
        return clamp01(base + CAI_DENSITY_AMPLIFIER * densityLevel(density));
    }

    // ---------------------------------------------------------------
    // Time and event
    // ---------------------------------------------------------------

    /**
     * @param localTime local time of day in the configured zone
     * @return {@code peak} inside a window, decaying linearly to {@code base}
     *         over the shoulder
     */
    public double timeIndex(LocalTime localTime) {
        int minute = minuteOfDay(localTime);
        double proximity = 0.0;
        for (int[] window : peakWindows) {
            proximity = Math.max(proximity, proximity(minute, window[0], window[1]));
        }
        return clamp01(timeBase + (timePeak - timeBase) * proximity);
    }

    public double eventIndex(Instant at) {
        return clamp01(calendar.intensityAt(at));
    }

    private double proximity(int minute, int start, int end) {
        boolean inside = start < end
                ? minute >= start && minute < end
                : minute >= start || minute < end;
        if (inside) {
            return 1.0;
        }
        if (shoulderMinutes == 0) {
            return 0.0;
        }
        int untilStart = Math.floorMod(start - minute, MINUTES_PER_DAY);
        int sinceEnd = Math.floorMod(minute - end, MINUTES_PER_DAY);
        int distance = Math.min(untilStart, sinceEnd);
        return Math.max(0.0, 1.0 - (double) distance / shoulderMinutes);
    }

    private static int minuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    private static double valueOrZero(Double value) {
        return value != null ? value : 0.0;
    }
}
