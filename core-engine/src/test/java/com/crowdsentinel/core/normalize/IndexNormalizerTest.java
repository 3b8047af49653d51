package com.crowdsentinel.core.normalize;

import com.crowdsentinel.core.config.EventIndexSettings;
import com.crowdsentinel.core.config.NormalizationSettings;
import com.crowdsentinel.core.config.TimeIndexSettings;
import com.crowdsentinel.core.model.IndexSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IndexNormalizer}.
 */
class IndexNormalizerTest {

    private static final double EPS = 1e-9;

    private IndexNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new IndexNormalizer(new NormalizationSettings());
    }

    @Test
    @DisplayName("THI should rescale between comfort and danger and clamp outside")
    void shouldComputeThi() {
        assertThat(IndexNormalizer.rawThi(30, 60)).isCloseTo(26.59, within(EPS));
        assertThat(normalizer.thi(30, 60)).isCloseTo(0.459, within(EPS));
        assertThat(normalizer.thi(20, 50)).isZero();
        assertThat(normalizer.thi(50, 90)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Density level should follow the Fruin bands")
    void shouldMapDensityBands() {
        assertThat(IndexNormalizer.densityLevel(0.5)).isCloseTo(0.075, within(EPS));
        assertThat(IndexNormalizer.densityLevel(1.5)).isCloseTo(0.275, within(EPS));
        assertThat(IndexNormalizer.densityLevel(2.0)).isCloseTo(0.40, within(EPS));
        assertThat(IndexNormalizer.densityLevel(3.5)).isCloseTo(0.75, within(EPS));
        assertThat(IndexNormalizer.densityLevel(10.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("CDI should grow with density and congestion")
    void shouldComputeCdi() {
        assertThat(normalizer.congestion(0.6)).isCloseTo(0.5, within(EPS));
        assertThat(normalizer.congestion(3.0)).isZero();
        assertThat(normalizer.cdi(2.5, 0.6)).isCloseTo(0.375, within(EPS));
        assertThat(normalizer.cdi(10.0, 0.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("CAI should fall back to density times congestion with a single reading")
    void shouldUseFallbackVolatilityWithoutHistory() {
        VariabilityWindow window = new VariabilityWindow(6);
        window.add(2.0, 0.6);

        assertThat(normalizer.volatility(2.0, 0.6, window)).isCloseTo(0.2, within(EPS));
        assertThat(normalizer.cai(2.0, 0.6, window, OptionalDouble.empty()))
                .isCloseTo(0.2 + 0.25 * 0.4, within(EPS));
    }

    @Test
    @DisplayName("CAI should blend volatility with the anxiety proxy when signals exist")
    void shouldBlendAnxietyProxy() {
        VariabilityWindow window = new VariabilityWindow(6);
        window.add(1.0, 1.0);
        window.add(1.25, 0.85);
        double densityBoost = 0.25 * IndexNormalizer.densityLevel(1.25);

        assertThat(normalizer.volatility(1.25, 0.85, window)).isCloseTo(0.5, within(1e-9));
        assertThat(normalizer.cai(1.25, 0.85, window, OptionalDouble.empty()))
                .isCloseTo(0.5 + densityBoost, within(1e-9));
        assertThat(normalizer.cai(1.25, 0.85, window, OptionalDouble.of(0.35)))
                .isCloseTo(0.425 + densityBoost, within(1e-9));
    }

    @Test
    @DisplayName("Time index should peak inside windows and decay over the shoulder")
    void shouldComputeTimeIndex() {
        assertThat(normalizer.timeIndex(LocalTime.of(7, 0))).isCloseTo(0.9, within(EPS));
        assertThat(normalizer.timeIndex(LocalTime.of(10, 30))).isCloseTo(0.5, within(EPS));
        assertThat(normalizer.timeIndex(LocalTime.of(2, 30))).isCloseTo(0.5, within(EPS));
        assertThat(normalizer.timeIndex(LocalTime.of(12, 0))).isCloseTo(0.1, within(EPS));
        assertThat(normalizer.timeIndex(LocalTime.of(23, 0))).isCloseTo(0.1, within(EPS));
    }

    @Test
    @DisplayName("A window that crosses midnight should wrap")
    void shouldWrapWindowsPastMidnight() {
        NormalizationSettings settings = new NormalizationSettings();
        settings.getTime().setPeakWindows(List.of(new TimeIndexSettings.PeakWindow("23:00", "01:00")));
        IndexNormalizer wrapped = new IndexNormalizer(settings);

        assertThat(wrapped.timeIndex(LocalTime.of(0, 30))).isCloseTo(0.9, within(EPS));
        assertThat(wrapped.timeIndex(LocalTime.of(22, 30))).isCloseTo(0.5, within(EPS));
        assertThat(wrapped.timeIndex(LocalTime.of(12, 0))).isCloseTo(0.1, within(EPS));
    }

    @Test
    @DisplayName("Event index should use the strongest active calendar entry")
    void shouldComputeEventIndex() {
        NormalizationSettings settings = new NormalizationSettings();
        settings.getEvent().setCalendar(List.of(
                new EventIndexSettings.CalendarEvent("procession", "2028-04-22T03:00", "2028-04-22T11:00", 0.6),
                new EventIndexSettings.CalendarEvent("royal-bath", "2028-04-22T05:00", "2028-04-22T07:00", 0.95)));
        IndexNormalizer withCalendar = new IndexNormalizer(settings);

        assertThat(withCalendar.eventIndex(Instant.parse("2028-04-22T04:00:00Z"))).isEqualTo(0.6);
        assertThat(withCalendar.eventIndex(Instant.parse("2028-04-22T06:00:00Z"))).isEqualTo(0.95);
        assertThat(withCalendar.eventIndex(Instant.parse("2028-04-22T11:00:00Z"))).isEqualTo(0.2);
    }

    @Test
    @DisplayName("Every index should stay inside [0,1] for extreme readings")
    void shouldKeepIndicesBounded() {
        VariabilityWindow window = new VariabilityWindow(6);
        window.add(0.0, 5.0);
        window.add(40.0, 0.0);
        SensorReading reading = SensorReading.of(60, 100, 40.0, 0.0, 1.0, 1.0, 1.0);

        IndexSet indices = normalizer.normalize(reading, window, Instant.parse("2028-04-22T07:00:00Z"));

        for (double value : new double[] { indices.getCai(), indices.getCdi(), indices.getThi(),
                indices.getTi(), indices.getEi(), indices.getAti(), indices.getSni(), indices.getPci() }) {
            assertThat(value).isBetween(0.0, 1.0);
        }
        assertThat(indices.getCdi()).isEqualTo(1.0);
        assertThat(indices.getTi()).isCloseTo(0.9, within(EPS));
    }
}
