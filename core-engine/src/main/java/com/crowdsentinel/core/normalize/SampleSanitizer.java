package com.crowdsentinel.core.normalize;

import com.crowdsentinel.core.model.RawSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Repairs input defects in raw samples.
 *
 * <p>
 * A missing or non-finite measurement is replaced by the last value seen for
 * that field, or by a neutral default before any value has been seen. An
 * out-of-range measurement is clamped into its physical range. Either repair
 * marks the field as degraded; nothing is ever rejected here.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This class is <strong>stateful</strong> (last-known-good values) and not
 * thread-safe. One instance belongs to one engine.
 * </p>
 *
 * @since 1.0.0
 */
public class SampleSanitizer implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SampleSanitizer.class);

    public static final String TEMPERATURE = "temperature";
    public static final String HUMIDITY = "humidity";
    public static final String DENSITY = "density";
    public static final String SPEED = "speed";
    public static final String ATTITUDE = "attitude";
    public static final String SUBJECTIVE_NORM = "subjectiveNorm";
    public static final String PERCEIVED_CONTROL = "perceivedControl";
    public static final String PUSH_RATE = "pushRate";
    public static final String SHOUT_RATE = "shoutRate";
    public static final String NEAR_FALLS = "nearFalls";

    static final double NEUTRAL_TEMPERATURE = 20.0;
    static final double NEUTRAL_HUMIDITY = 50.0;
    static final double NEUTRAL_DENSITY = 0.5;
    static final double NEUTRAL_BEHAVIOR = 0.5;

    static final double MIN_TEMPERATURE = -40.0;
    static final double MAX_TEMPERATURE = 60.0;

    private final double neutralSpeed;
    private final Map<String, Double> lastKnownGood = new HashMap<>();

    /**
     * @param freeFlowSpeed neutral speed used before the first valid reading
     */
    public SampleSanitizer(double freeFlowSpeed) {
        this.neutralSpeed = freeFlowSpeed;
    }

    /**
     * Sanitize one sample and update the last-known-good values.
     *
     * @param sample the raw sample; must not be {@code null}
     * @return a complete reading with its degraded-field list
     */
    public SensorReading sanitize(RawSample sample) {
        Objects.requireNonNull(sample, "RawSample must not be null");
        List<String> degraded = new ArrayList<>();

        double temperature = resolve(TEMPERATURE, sample.getTemperature(),
                MIN_TEMPERATURE, MAX_TEMPERATURE, NEUTRAL_TEMPERATURE, degraded);
        double humidity = resolve(HUMIDITY, sample.getHumidity(), 0.0, 100.0, NEUTRAL_HUMIDITY, degraded);
        double density = resolve(DENSITY, sample.getDensity(), 0.0, Double.MAX_VALUE, NEUTRAL_DENSITY, degraded);
        double speed = resolve(SPEED, sample.getSpeed(), 0.0, Double.MAX_VALUE, neutralSpeed, degraded);
        double attitude = resolve(ATTITUDE, sample.getAttitude(), 0.0, 1.0, NEUTRAL_BEHAVIOR, degraded);
        double norm = resolve(SUBJECTIVE_NORM, sample.getSubjectiveNorm(), 0.0, 1.0, NEUTRAL_BEHAVIOR, degraded);
        double control = resolve(PERCEIVED_CONTROL, sample.getPerceivedControl(),
                0.0, 1.0, NEUTRAL_BEHAVIOR, degraded);

        Double pushRate = optionalSignal(PUSH_RATE, sample.getPushRate(), degraded);
        Double shoutRate = optionalSignal(SHOUT_RATE, sample.getShoutRate(), degraded);
        Double nearFalls = optionalSignal(NEAR_FALLS, sample.getNearFalls(), degraded);

        Collections.sort(degraded);
        return new SensorReading(temperature, humidity, density, speed, attitude, norm, control,
                pushRate, shoutRate, nearFalls, degraded);
    }

    private double resolve(String field, Double raw, double min, double max, double neutral,
            List<String> degraded) {
        if (raw == null || !Double.isFinite(raw)) {
            double substitute = lastKnownGood.getOrDefault(field, neutral);
            LOG.trace("Field '{}' missing or non-finite ({}), substituting {}", field, raw, substitute);
            degraded.add(field);
            return substitute;
        }
        double value = raw;
        if (value < min || value > max) {
            value = Math.max(min, Math.min(max, value));
            LOG.trace("Field '{}' out of range ({}), clamped to {}", field, raw, value);
            degraded.add(field);
        }
        lastKnownGood.put(field, value);
        return value;
    }

    private static Double optionalSignal(String field, Double raw, List<String> degraded) {
        if (raw == null) {
            return null;
        }
        if (!Double.isFinite(raw) || raw < 0) {
            LOG.trace("Optional signal '{}' invalid ({}), ignoring", field, raw);
            degraded.add(field);
            return null;
        }
        return raw;
    }
}
