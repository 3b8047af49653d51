package com.crowdsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * One raw crowd-sensor reading.
 *
 * <p>
 * Physical and behavioral measurements are nullable: a field that was missing
 * or could not be read as a number is stored as {@code null} and repaired
 * later by the sanitizer rather than rejected here. The optional anxiety
 * signals ({@code pushRate}, {@code shoutRate}, {@code nearFalls}) are
 * legitimately absent for deployments without CCTV analytics.
 * </p>
 *
 * <p>
 * Instances are immutable. Use {@link #builder()} in code and
 * {@link #fromFields(Map)} for decoded JSON.
 * </p>
 *
 * @since 1.0.0
 */
public final class RawSample implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Zone used when a sample does not name one. */
    public static final String DEFAULT_ZONE = "default";

    private final Instant timestamp;
    private final String zone;
    private final String phase;

    private final Double temperature;
    private final Double humidity;
    private final Double density;
    private final Double speed;

    private final Double attitude;
    private final Double subjectiveNorm;
    private final Double perceivedControl;

    private final Double pushRate;
    private final Double shoutRate;
    private final Double nearFalls;

    private RawSample(Builder b) {
        this.timestamp = b.timestamp;
        this.zone = (b.zone == null || b.zone.isBlank()) ? DEFAULT_ZONE : b.zone;
        this.phase = b.phase;
        this.temperature = b.temperature;
        this.humidity = b.humidity;
        this.density = b.density;
        this.speed = b.speed;
        this.attitude = b.attitude;
        this.subjectiveNorm = b.subjectiveNorm;
        this.perceivedControl = b.perceivedControl;
        this.pushRate = b.pushRate;
        this.shoutRate = b.shoutRate;
        this.nearFalls = b.nearFalls;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lenient construction from decoded JSON
    // ---------------------------------------------------------------

    /**
     * Build a sample from a decoded JSON object.
     *
     * <p>
     * Numbers are used as-is and numeric strings are parsed. Any other value
     * is treated as absent, so an ill-typed field degrades the snapshot
     * instead of dropping the whole record. The timestamp may be an ISO-8601
     * instant, an ISO local date-time (read as UTC) or epoch milliseconds.
     * </p>
     *
     * <p>
     * Field names are camelCase; the sensor-gateway names ({@code temp_c},
     * {@code rh}, {@code density_p_m2}, {@code speed_mps}, {@code ATI},
     * {@code SNI}, {@code PCI}, {@code push_rate}, {@code shout_rate},
     * {@code near_falls}) are accepted as aliases. The camelCase name wins
     * when both are present.
     * </p>
     *
     * @param fields decoded JSON properties; must not be {@code null}
     * @return the sample
     */
    public static RawSample fromFields(Map<String, Object> fields) {
        Objects.requireNonNull(fields, "Fields must not be null");
        return builder()
                .timestamp(timestampField(fields.get("timestamp")))
                .zone(stringField(fields.get("zone")))
                .phase(stringField(fields.get("phase")))
                .temperature(numericField(field(fields, "temperature", "temp_c")))
                .humidity(numericField(field(fields, "humidity", "rh")))
                .density(numericField(field(fields, "density", "density_p_m2")))
                .speed(numericField(field(fields, "speed", "speed_mps")))
                .attitude(numericField(field(fields, "attitude", "ATI")))
                .subjectiveNorm(numericField(field(fields, "subjectiveNorm", "SNI")))
                .perceivedControl(numericField(field(fields, "perceivedControl", "PCI")))
                .pushRate(numericField(field(fields, "pushRate", "push_rate")))
                .shoutRate(numericField(field(fields, "shoutRate", "shout_rate")))
                .nearFalls(numericField(field(fields, "nearFalls", "near_falls")))
                .build();
    }

    private static Object field(Map<String, Object> fields, String name, String alias) {
        Object value = fields.get(name);
        return value != null ? value : fields.get(alias);
    }

    static Double numericField(Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static Instant timestampField(Object raw) {
        if (raw instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Instant.parse(s.trim());
            } catch (DateTimeParseException e) {
                try {
                    return LocalDateTime.parse(s.trim()).toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException ignored) {
                    return null;
                }
            }
        }
        return null;
    }

    private static String stringField(Object raw) {
        return raw == null ? null : raw.toString();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return sample timestamp, or {@code null} if the feed did not provide a
     *         readable one
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    public String getZone() {
        return zone;
    }

    /**
     * @return informational scenario tag; never used by any formula
     */
    public String getPhase() {
        return phase;
    }

    /** @return air temperature in °C */
    public Double getTemperature() {
        return temperature;
    }

    /** @return relative humidity in percent */
    public Double getHumidity() {
        return humidity;
    }

    /** @return crowd density in people per m² */
    public Double getDensity() {
        return density;
    }

    /** @return mean crowd speed in m/s */
    public Double getSpeed() {
        return speed;
    }

    public Double getAttitude() {
        return attitude;
    }

    public Double getSubjectiveNorm() {
        return subjectiveNorm;
    }

    public Double getPerceivedControl() {
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

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RawSample}. Every field is optional.
     */
    public static class Builder {
        private Instant timestamp;
        private String zone;
        private String phase;
        private Double temperature;
        private Double humidity;
        private Double density;
        private Double speed;
        private Double attitude;
        private Double subjectiveNorm;
        private Double perceivedControl;
        private Double pushRate;
        private Double shoutRate;
        private Double nearFalls;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder zone(String zone) {
            this.zone = zone;
            return this;
        }

        public Builder phase(String phase) {
            this.phase = phase;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder humidity(Double humidity) {
            this.humidity = humidity;
            return this;
        }

        public Builder density(Double density) {
            this.density = density;
            return this;
        }

        public Builder speed(Double speed) {
            this.speed = speed;
            return this;
        }

        public Builder attitude(Double attitude) {
            this.attitude = attitude;
            return this;
        }

        public Builder subjectiveNorm(Double subjectiveNorm) {
            this.subjectiveNorm = subjectiveNorm;
            return this;
        }

        public Builder perceivedControl(Double perceivedControl) {
            this.perceivedControl = perceivedControl;
            return this;
        }

        public Builder pushRate(Double pushRate) {
            this.pushRate = pushRate;
            return this;
        }

        public Builder shoutRate(Double shoutRate) {
            this.shoutRate = shoutRate;
            return this;
        }

        public Builder nearFalls(Double nearFalls) {
            this.nearFalls = nearFalls;
            return this;
        }

        public RawSample build() {
            return new RawSample(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RawSample that))
            return false;
        return Objects.equals(timestamp, that.timestamp)
                && Objects.equals(zone, that.zone)
                && Objects.equals(phase, that.phase)
                && Objects.equals(temperature, that.temperature)
                && Objects.equals(humidity, that.humidity)
                && Objects.equals(density, that.density)
                && Objects.equals(speed, that.speed)
                && Objects.equals(attitude, that.attitude)
                && Objects.equals(subjectiveNorm, that.subjectiveNorm)
                && Objects.equals(perceivedControl, that.perceivedControl)
                && Objects.equals(pushRate, that.pushRate)
                && Objects.equals(shoutRate, that.shoutRate)
                && Objects.equals(nearFalls, that.nearFalls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, zone, phase, temperature, humidity, density, speed,
                attitude, subjectiveNorm, perceivedControl, pushRate, shoutRate, nearFalls);
    }

    @Override
    public String toString() {
        return "RawSample{" +
                "timestamp=" + timestamp +
                ", zone='" + zone + '\'' +
                ", phase='" + phase + '\'' +
                ", temperature=" + temperature +
                ", humidity=" + humidity +
                ", density=" + density +
                ", speed=" + speed +
                ", attitude=" + attitude +
                ", subjectiveNorm=" + subjectiveNorm +
                ", perceivedControl=" + perceivedControl +
                '}';
    }
}
