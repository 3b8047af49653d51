package com.crowdsentinel.core.normalize;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * A {@link com.crowdsentinel.core.model.RawSample} after sanitization: every
 * required measurement is present, finite and inside its physical range.
 *
 * <p>
 * The optional anxiety signals stay {@code null} when the feed does not
 * provide them.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensorReading implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double temperature;
    private final double humidity;
    private final double density;
    private final double speed;
    private final double attitude;
    private final double subjectiveNorm;
    private final double perceivedControl;
    private final Double pushRate;
    private final Double shoutRate;
    private final Double nearFalls;
    private final List<String> degradedFields;

    SensorReading(double temperature, double humidity, double density, double speed,
            double attitude, double subjectiveNorm, double perceivedControl,
            Double pushRate, Double shoutRate, Double nearFalls, List<String> degradedFields) {
        this.temperature = temperature;
        this.humidity = humidity;
        this.density = density;
        this.speed = speed;
        this.attitude = attitude;
        this.subjectiveNorm = subjectiveNorm;
        this.perceivedControl = perceivedControl;
        this.pushRate = pushRate;
        this.shoutRate = shoutRate;
        this.nearFalls = nearFalls;
        this.degradedFields = Collections.unmodifiableList(degradedFields);
    }

    /**
     * Reading with no optional signals and no repairs. Intended for callers
     * that already hold clean values, such as tests and replays.
     */
    public static SensorReading of(double temperature, double humidity, double density, double speed,
            double attitude, double subjectiveNorm, double perceivedControl) {
        return new SensorReading(temperature, humidity, density, speed, attitude, subjectiveNorm,
                perceivedControl, null, null, null, List.of());
    }

    public double getTemperature() {
        return temperature;
    }

    public double getHumidity() {
        return humidity;
    }

    public double getDensity() {
        return density;
    }

    public double getSpeed() {
        return speed;
    }

    public double getAttitude() {
        return attitude;
    }

    public double getSubjectiveNorm() {
        return subjectiveNorm;
    }

    public double getPerceivedControl() {
        return perceivedControl;
    }

    public Double getPushRate() {
        return pushRate;
    }

    public Double getShoutRate() {
        return shoutRate;
    }

    public Double getNearFalls() {
        return nearFalls;
    }

    /**
     * @return {@code true} if at least one anxiety signal is present
     */
    public boolean hasAnxietySignals() {
        return pushRate != null || shoutRate != null || nearFalls != null;
    }

    /**
     * @return sorted names of fields that were substituted or clamped
     */
    public List<String> getDegradedFields() {
        return degradedFields;
    }

    @Override
    public String toString() {
        return "SensorReading{" +
                "temperature=" + temperature +
                ", humidity=" + humidity +
                ", density=" + density +
                ", speed=" + speed +
                ", attitude=" + attitude +
                ", subjectiveNorm=" + subjectiveNorm +
                ", perceivedControl=" + perceivedControl +
                ", degradedFields=" + degradedFields +
                '}';
    }
}
