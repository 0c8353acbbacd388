package com.smartbin.domain.analytics;

import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.model.Reading;
import com.smartbin.domain.model.ServiceResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StatsEngine}.
 */
class StatsEngineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 15, 12, 0);
    private static final double EPS = 1e-6;

    private StatsEngine engine;

    @BeforeEach
    void setUp() {
        engine = new StatsEngine();
    }

    // --- aggregate ---

    @Test
    @DisplayName("Should compute total, mean, extremes, median and population std-dev")
    void shouldAggregate() {
        ServiceResult<AggregateStats> result = engine.aggregate(List.of(
                reading(NOW.minusHours(3), 1),
                reading(NOW.minusHours(2), 2),
                reading(NOW.minusHours(1), 9)));

        assertThat(result.isSuccess()).isTrue();
        AggregateStats stats = result.getValue();
        assertThat(stats.getTotal()).isCloseTo(12.0, within(EPS));
        assertThat(stats.getMean()).isCloseTo(4.0, within(EPS));
        assertThat(stats.getMax()).isEqualTo(9.0);
        assertThat(stats.getMin()).isEqualTo(1.0);
        assertThat(stats.getMedian()).isEqualTo(2.0);
        assertThat(stats.getCount()).isEqualTo(3);
        assertThat(stats.getStdDev()).isCloseTo(Math.sqrt(38.0 / 3), within(EPS));
    }

    @Test
    @DisplayName("Should report zero std-dev and a mean equal to the extremes when all weights match")
    void shouldAggregateEqualWeights() {
        AggregateStats stats = engine.aggregate(List.of(
                reading(NOW.minusHours(3), 2.5),
                reading(NOW.minusHours(2), 2.5),
                reading(NOW.minusHours(1), 2.5))).getValue();

        assertThat(stats.getStdDev()).isCloseTo(0.0, within(EPS));
        assertThat(stats.getMean()).isCloseTo(2.5, within(EPS));
        assertThat(stats.getMin()).isEqualTo(2.5);
        assertThat(stats.getMax()).isEqualTo(2.5);
        assertThat(stats.getMedian()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Should keep a positive std-dev and a mean between min and max for distinct weights")
    void shouldBoundMeanByExtremes() {
        AggregateStats stats = engine.aggregate(List.of(
                reading(NOW.minusHours(2), 3),
                reading(NOW.minusHours(1), 7))).getValue();

        assertThat(stats.getStdDev()).isCloseTo(2.0, within(EPS));
        assertThat(stats.getMean()).isBetween(stats.getMin(), stats.getMax());
    }

    @Test
    @DisplayName("Should average the two middle values for an even count median")
    void shouldComputeEvenMedian() {
        AggregateStats stats = engine.aggregate(List.of(
                reading(NOW, 4), reading(NOW, 1), reading(NOW, 3), reading(NOW, 2))).getValue();

        assertThat(stats.getMedian()).isCloseTo(2.5, within(EPS));
    }

    @Test
    @DisplayName("Should report NO_DATA for an empty window")
    void shouldReportNoDataWhenEmpty() {
        ServiceResult<AggregateStats> result = engine.aggregate(List.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo(ErrorKind.NO_DATA);
    }

    // --- detectAnomalies ---

    @Test
    @DisplayName("Should flag only the reading above mean + k*sigma as high severity")
    void shouldFlagOutlierAsHigh() {
        List<Anomaly> anomalies = engine.detectAnomalies(List.of(
                reading(NOW.minusHours(3), 1),
                reading(NOW.minusHours(2), 2),
                reading(NOW.minusHours(1), 9)), 1.0);

        assertThat(anomalies).hasSize(1);
        Anomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getWeightKg()).isEqualTo(9.0);
        // 9 > 4 + 3.559 but not > 1.5 * 7.559
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(anomaly.getStdDeviations()).isCloseTo(5.0 / Math.sqrt(38.0 / 3), within(EPS));
    }

    @Test
    @DisplayName("Should mark a reading above 1.5x the threshold as critical")
    void shouldFlagCritical() {
        List<Anomaly> anomalies = engine.detectAnomalies(List.of(
                reading(NOW.minusHours(5), 1),
                reading(NOW.minusHours(4), 1),
                reading(NOW.minusHours(3), 1),
                reading(NOW.minusHours(2), 1),
                reading(NOW.minusHours(1), 10)), 0.0);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomalies.get(0).getSeverity().getLabel()).isEqualTo("Crítica");
    }

    @Test
    @DisplayName("Should not flag a reading exactly at the threshold")
    void shouldUseStrictThreshold() {
        List<Anomaly> anomalies = engine.detectAnomalies(List.of(
                reading(NOW.minusHours(2), 5),
                reading(NOW.minusHours(1), 5),
                reading(NOW, 5)), 0.0);

        assertThat(anomalies).isEmpty();
    }

    @Test
    @DisplayName("Should return anomalies most recent first")
    void shouldOrderAnomaliesNewestFirst() {
        List<Reading> readings = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            readings.add(reading(NOW.minusDays(10).plusHours(i), 1));
        }
        readings.add(reading(NOW.minusDays(3), 20));
        readings.add(reading(NOW.minusDays(1), 25));

        List<Anomaly> anomalies = engine.detectAnomalies(readings, 1.0);

        assertThat(anomalies).extracting(Anomaly::getWeightKg).containsExactly(25.0, 20.0);
    }

    @Test
    @DisplayName("Should return no anomalies for an empty window")
    void shouldHandleEmptyAnomalyWindow() {
        assertThat(engine.detectAnomalies(List.of(), StatsEngine.DEFAULT_SENSITIVITY)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a negative sensitivity")
    void shouldRejectNegativeSensitivity() {
        assertThatThrownBy(() -> engine.detectAnomalies(List.of(reading(NOW, 1)), -0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sensitivity");
    }

    // --- forecast ---

    @Test
    @DisplayName("Should fit a perfect line over increasing daily totals")
    void shouldForecastLinearTrend() {
        // Totales diarios 10, 12, 14, 16, 18
        List<Reading> readings = new ArrayList<>();
        for (int day = 0; day < 5; day++) {
            double half = (10 + 2 * day) / 2.0;
            LocalDateTime ts = NOW.minusDays(5 - day);
            readings.add(reading(ts, half));
            readings.add(reading(ts.plusMinutes(30), half));
        }

        Forecast forecast = engine.forecast(readings, 2, NOW).getValue();

        assertThat(forecast.getModel()).isEqualTo("Linear Regression");
        assertThat(forecast.getTrainingDays()).isEqualTo(5);
        assertThat(forecast.getSlope()).isCloseTo(2.0, within(EPS));
        assertThat(forecast.getIntercept()).isCloseTo(10.0, within(EPS));
        assertThat(forecast.getRSquared()).isCloseTo(1.0, within(EPS));
        assertThat(forecast.getConfidence()).isEqualTo(Confidence.HIGH);
        assertThat(forecast.getPredictions()).hasSize(2);
        assertThat(forecast.getPredictions().get(0).getPredictedKg()).isCloseTo(20.0, within(EPS));
        assertThat(forecast.getPredictions().get(1).getPredictedKg()).isCloseTo(22.0, within(EPS));
        assertThat(forecast.getPredictions().get(0).getEstimatedDate()).isEqualTo(NOW.plusDays(1));
    }

    @Test
    @DisplayName("Should never predict negative weights")
    void shouldClampPredictionsAtZero() {
        // Totales diarios 40, 30, 20, 10, 0
        List<Reading> readings = new ArrayList<>();
        for (int day = 0; day < 5; day++) {
            double half = (40 - 10 * day) / 2.0;
            LocalDateTime ts = NOW.minusDays(5 - day);
            readings.add(reading(ts, half));
            readings.add(reading(ts.plusMinutes(30), half));
        }

        Forecast forecast = engine.forecast(readings, 3, NOW).getValue();

        assertThat(forecast.getSlope()).isCloseTo(-10.0, within(EPS));
        assertThat(forecast.getPredictions())
                .extracting(ForecastPoint::getPredictedKg)
                .containsOnly(0.0);
    }

    @Test
    @DisplayName("Should report a perfect fit for constant daily totals")
    void shouldTreatConstantTotalsAsPerfectFit() {
        List<Reading> readings = new ArrayList<>();
        for (int day = 0; day < 5; day++) {
            readings.add(reading(NOW.minusDays(5 - day), 5));
            readings.add(reading(NOW.minusDays(5 - day).plusHours(1), 5));
        }

        Forecast forecast = engine.forecast(readings, 1, NOW).getValue();

        assertThat(forecast.getSlope()).isCloseTo(0.0, within(EPS));
        assertThat(forecast.getRSquared()).isEqualTo(1.0);
        assertThat(forecast.getPredictions().get(0).getPredictedKg()).isCloseTo(10.0, within(EPS));
    }

    @Test
    @DisplayName("Should use a flat line with zero R-squared for a single training day")
    void shouldHandleSingleDay() {
        List<Reading> readings = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            readings.add(reading(NOW.withHour(1).plusMinutes(i), 1.5));
        }

        Forecast forecast = engine.forecast(readings, 1, NOW).getValue();

        assertThat(forecast.getTrainingDays()).isEqualTo(1);
        assertThat(forecast.getSlope()).isEqualTo(0.0);
        assertThat(forecast.getIntercept()).isCloseTo(15.0, within(EPS));
        assertThat(forecast.getRSquared()).isEqualTo(0.0);
        assertThat(forecast.getConfidence()).isEqualTo(Confidence.LOW);
    }

    @Test
    @DisplayName("Should require at least ten readings to forecast")
    void shouldRequireMinimumReadings() {
        List<Reading> readings = new ArrayList<>();
        for (int i = 0; i < StatsEngine.MIN_FORECAST_READINGS - 1; i++) {
            readings.add(reading(NOW.minusDays(i), 3));
        }

        ServiceResult<Forecast> result = engine.forecast(readings, 7, NOW);

        assertThat(result.getError()).isEqualTo(ErrorKind.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("Should reject a non-positive forecast horizon")
    void shouldRejectZeroFutureDays() {
        assertThat(engine.forecast(List.of(), 0, NOW).getError()).isEqualTo(ErrorKind.VALIDATION);
    }

    // --- comparePeriods ---

    @Test
    @DisplayName("Should compare the current period against the previous one")
    void shouldComparePeriods() {
        List<Reading> readings = List.of(
                reading(NOW.minusDays(10), 5),
                reading(NOW.minusDays(8), 5),
                reading(NOW.minusDays(2), 10),
                reading(NOW.minusDays(1), 20));

        PeriodComparison comparison = engine.comparePeriods(readings, 7, 7, NOW).getValue();

        assertThat(comparison.getCurrent().getTotalKg()).isCloseTo(30.0, within(EPS));
        assertThat(comparison.getCurrent().getCount()).isEqualTo(2);
        assertThat(comparison.getPrevious().getTotalKg()).isCloseTo(10.0, within(EPS));
        assertThat(comparison.getTotalChangePercent()).isCloseTo(200.0, within(EPS));
        assertThat(comparison.getMeanChangePercent()).isCloseTo(200.0, within(EPS));
        assertThat(comparison.getTendency()).isEqualTo(Tendency.INCREASE);
    }

    @Test
    @DisplayName("Should report zero change when the previous period is empty")
    void shouldReportZeroChangeWithoutBaseline() {
        PeriodComparison comparison = engine.comparePeriods(
                List.of(reading(NOW.minusDays(1), 8)), 7, 7, NOW).getValue();

        assertThat(comparison.getPrevious().getCount()).isZero();
        assertThat(comparison.getTotalChangePercent()).isEqualTo(0.0);
        assertThat(comparison.getMeanChangePercent()).isEqualTo(0.0);
        assertThat(comparison.getTendency()).isEqualTo(Tendency.INCREASE);
    }

    @Test
    @DisplayName("Should report a decrease when totals are equal")
    void shouldReportDecreaseWhenUnchanged() {
        PeriodComparison comparison = engine.comparePeriods(List.of(
                reading(NOW.minusDays(9), 4),
                reading(NOW.minusDays(2), 4)), 7, 7, NOW).getValue();

        assertThat(comparison.getTotalChangePercent()).isEqualTo(0.0);
        assertThat(comparison.getTendency()).isEqualTo(Tendency.DECREASE);
        assertThat(comparison.getTendency().getLabel()).isEqualTo("Redução");
    }

    @Test
    @DisplayName("Should report NO_DATA when there is nothing to compare")
    void shouldReportNoDataForEmptyComparison() {
        assertThat(engine.comparePeriods(List.of(), 7, 7, NOW).getError()).isEqualTo(ErrorKind.NO_DATA);
    }

    // --- analyzePatterns ---

    @Test
    @DisplayName("Should find the peak hour and distinct sensors")
    void shouldAnalyzePatterns() {
        LocalDateTime day = LocalDateTime.of(2024, 3, 14, 0, 0);
        List<Reading> readings = List.of(
                reading(day.withHour(8), 2, "s1"),
                reading(day.withHour(13), 7, "s2"),
                reading(day.withHour(13).plusMinutes(20), 3, "s1"),
                reading(day.plusDays(1).withHour(8), 1, "s1"));

        PatternAnalysis patterns = engine.analyzePatterns(readings, 30).getValue();

        assertThat(patterns.getPeakHour()).isEqualTo(13);
        assertThat(patterns.getByHour().get(13).getTotal()).isCloseTo(10.0, within(EPS));
        assertThat(patterns.getByHour().get(13).getCount()).isEqualTo(2);
        assertThat(patterns.getPeakDay()).isEqualTo(day.toLocalDate());
        assertThat(patterns.getDailyMean()).isCloseTo(6.5, within(EPS));
        assertThat(patterns.getSensors()).containsExactly("s1", "s2");
        assertThat(patterns.getStats().getTotal()).isCloseTo(13.0, within(EPS));
    }

    private static Reading reading(LocalDateTime timestamp, double weight) {
        return reading(timestamp, weight, "esp32-01");
    }

    private static Reading reading(LocalDateTime timestamp, double weight, String sensorId) {
        return Reading.builder()
                .timestamp(timestamp)
                .weightKg(weight)
                .sensorId(sensorId)
                .temperature(20)
                .humidity(50)
                .build();
    }
}
