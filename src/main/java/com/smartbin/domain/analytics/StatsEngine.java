package com.smartbin.domain.analytics;

import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.model.Reading;
import com.smartbin.domain.model.ServiceResult;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cálculos estadísticos sobre lecturas de peso.
 *
 * <p>
 * No accede al almacenamiento: recibe las lecturas ya filtradas por ventana de
 * tiempo y devuelve resultados tipados. Una entrada vacía produce un resultado
 * {@link ErrorKind#NO_DATA}, nunca una excepción.
 * </p>
 */
public class StatsEngine {

    /** Lecturas mínimas en la ventana de entrenamiento para predecir */
    public static final int MIN_FORECAST_READINGS = 10;

    /** Sensibilidad por defecto (k) de la detección de anomalías */
    public static final double DEFAULT_SENSITIVITY = 2.0;

    /** Factor sobre el umbral a partir del cual una anomalía es crítica */
    static final double CRITICAL_FACTOR = 1.5;

    static final String NO_DATA_MESSAGE = "Sem dados";

    /**
     * Total, media, máximo, mínimo, desvío estándar poblacional, mediana y
     * cantidad sobre peso_kg.
     */
    public ServiceResult<AggregateStats> aggregate(List<Reading> readings) {
        if (readings == null || readings.isEmpty()) {
            return ServiceResult.failure(ErrorKind.NO_DATA, NO_DATA_MESSAGE);
        }
        return ServiceResult.success(computeStats(weights(readings)));
    }

    /**
     * Ajusta una regresión lineal simple (índice de día → total diario) y
     * predice los próximos {@code futureDays} días.
     *
     * @param readings   lecturas de la ventana de entrenamiento
     * @param futureDays días a predecir (>= 1)
     * @param now        instante de referencia para las fechas estimadas
     */
    public ServiceResult<Forecast> forecast(List<Reading> readings, int futureDays, LocalDateTime now) {
        if (futureDays < 1) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "dias deve ser maior que zero");
        }
        if (readings == null || readings.size() < MIN_FORECAST_READINGS) {
            return ServiceResult.failure(ErrorKind.INSUFFICIENT_DATA, "Dados insuficientes para predição");
        }

        // Totales diarios ordenados por fecha; solo cuentan los días con datos
        TreeMap<LocalDate, Double> dailyTotals = dailyTotals(readings);
        double[] ys = dailyTotals.values().stream().mapToDouble(Double::doubleValue).toArray();
        int n = ys.length;

        double meanX = (n - 1) / 2.0;
        double meanY = mean(ys);

        double sxx = 0;
        double sxy = 0;
        for (int x = 0; x < n; x++) {
            sxx += (x - meanX) * (x - meanX);
            sxy += (x - meanX) * (ys[x] - meanY);
        }

        double slope = sxx == 0 ? 0 : sxy / sxx;
        double intercept = meanY - slope * meanX;
        double rSquared = rSquared(ys, slope, intercept);

        List<ForecastPoint> predictions = new ArrayList<>();
        for (int i = 0; i < futureDays; i++) {
            double predicted = Math.max(0, intercept + slope * (n + i));
            predictions.add(ForecastPoint.builder()
                    .day(i + 1)
                    .predictedKg(predicted)
                    .estimatedDate(now.plusDays(i + 1L))
                    .build());
        }

        return ServiceResult.success(Forecast.builder()
                .model("Linear Regression")
                .trainingDays(n)
                .slope(slope)
                .intercept(intercept)
                .rSquared(rSquared)
                .confidence(Confidence.fromRSquared(rSquared))
                .predictions(predictions)
                .build());
    }

    /**
     * Marca como anómala toda lectura con peso estrictamente mayor que
     * {@code media + sensitivity·σ}. El resultado se ordena del más reciente al
     * más antiguo.
     *
     * @throws IllegalArgumentException si la sensibilidad es negativa
     */
    public List<Anomaly> detectAnomalies(List<Reading> readings, double sensitivity) {
        if (sensitivity < 0 || Double.isNaN(sensitivity)) {
            throw new IllegalArgumentException("sensitivity must be >= 0, got: " + sensitivity);
        }
        if (readings == null || readings.isEmpty()) {
            return List.of();
        }

        double[] values = weights(readings);
        double mean = mean(values);
        double stdDev = populationStdDev(values, mean);
        double threshold = mean + sensitivity * stdDev;

        return readings.stream()
                .filter(r -> r.getWeightKg() > threshold)
                .sorted(Comparator.comparing(Reading::getTimestamp,
                        Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder())).reversed())
                .map(r -> Anomaly.builder()
                        .timestamp(r.getTimestamp())
                        .weightKg(r.getWeightKg())
                        .sensorId(r.getSensorId())
                        .stdDeviations(stdDev > 0 ? (r.getWeightKg() - mean) / stdDev : 0)
                        .severity(r.getWeightKg() > threshold * CRITICAL_FACTOR
                                ? Severity.CRITICAL
                                : Severity.HIGH)
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Compara los últimos {@code currentDays} días con los {@code previousDays}
     * días anteriores.
     */
    public ServiceResult<PeriodComparison> comparePeriods(List<Reading> readings, int currentDays,
            int previousDays, LocalDateTime now) {
        if (currentDays < 1 || previousDays < 1) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "periodos devem ter ao menos um dia");
        }
        if (readings == null || readings.isEmpty()) {
            return ServiceResult.failure(ErrorKind.NO_DATA, NO_DATA_MESSAGE);
        }

        LocalDateTime currentStart = now.minusDays(currentDays);
        LocalDateTime previousStart = currentStart.minusDays(previousDays);

        List<Reading> current = readings.stream()
                .filter(r -> !r.getTimestamp().isBefore(currentStart))
                .collect(Collectors.toList());
        List<Reading> previous = readings.stream()
                .filter(r -> !r.getTimestamp().isBefore(previousStart) && r.getTimestamp().isBefore(currentStart))
                .collect(Collectors.toList());

        PeriodSummary currentSummary = summarize(current, currentDays);
        PeriodSummary previousSummary = summarize(previous, previousDays);

        double totalDelta = currentSummary.getTotalKg() - previousSummary.getTotalKg();

        return ServiceResult.success(PeriodComparison.builder()
                .current(currentSummary)
                .previous(previousSummary)
                .totalChangePercent(percentChange(currentSummary.getTotalKg(), previousSummary.getTotalKg()))
                .meanChangePercent(percentChange(currentSummary.getMeanKg(), previousSummary.getMeanKg()))
                .tendency(totalDelta > 0 ? Tendency.INCREASE : Tendency.DECREASE)
                .build());
    }

    /**
     * Agrupa las lecturas por hora del día y por día de la semana, y calcula
     * picos y medias ambientales.
     */
    public ServiceResult<PatternAnalysis> analyzePatterns(List<Reading> readings, int days) {
        if (readings == null || readings.isEmpty()) {
            return ServiceResult.failure(ErrorKind.NO_DATA, NO_DATA_MESSAGE);
        }

        Map<Integer, BucketStats> byHour = new TreeMap<Integer, BucketStats>(
                this.<Integer>bucket(readings, r -> r.getTimestamp().getHour()));
        Map<DayOfWeek, BucketStats> byWeekday = new EnumMap<DayOfWeek, BucketStats>(
                this.<DayOfWeek>bucket(readings, r -> r.getTimestamp().getDayOfWeek()));

        TreeMap<LocalDate, Double> dailyTotals = dailyTotals(readings);

        int peakHour = byHour.entrySet().stream()
                .max(Map.Entry.comparingByValue(Comparator.comparingDouble(BucketStats::getTotal)))
                .map(Map.Entry::getKey)
                .orElse(0);
        LocalDate peakDay = dailyTotals.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null);

        List<String> sensors = readings.stream()
                .map(Reading::getSensorId)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .collect(Collectors.toList());

        return ServiceResult.success(PatternAnalysis.builder()
                .days(days)
                .stats(computeStats(weights(readings)))
                .dailyMean(dailyTotals.values().stream().mapToDouble(Double::doubleValue).average().orElse(0))
                .byHour(byHour)
                .byWeekday(byWeekday)
                .peakHour(peakHour)
                .peakDay(peakDay)
                .meanTemperature(readings.stream().mapToDouble(Reading::getTemperature).average().orElse(0))
                .meanHumidity(readings.stream().mapToDouble(Reading::getHumidity).average().orElse(0))
                .sensors(sensors)
                .build());
    }

    // --- Helpers ---

    private AggregateStats computeStats(double[] values) {
        double total = 0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            total += v;
            max = Math.max(max, v);
            min = Math.min(min, v);
        }
        double mean = total / values.length;

        return AggregateStats.builder()
                .total(total)
                .mean(mean)
                .max(max)
                .min(min)
                .stdDev(populationStdDev(values, mean))
                .median(median(values))
                .count(values.length)
                .build();
    }

    private PeriodSummary summarize(List<Reading> readings, int days) {
        double total = readings.stream().mapToDouble(Reading::getWeightKg).sum();
        return PeriodSummary.builder()
                .days(days)
                .totalKg(total)
                .meanKg(readings.isEmpty() ? 0 : total / readings.size())
                .count(readings.size())
                .build();
    }

    private <K> Map<K, BucketStats> bucket(List<Reading> readings, Function<Reading, K> key) {
        return readings.stream().collect(Collectors.groupingBy(key, Collectors.collectingAndThen(
                Collectors.toList(),
                group -> {
                    double total = group.stream().mapToDouble(Reading::getWeightKg).sum();
                    return BucketStats.builder()
                            .total(total)
                            .mean(total / group.size())
                            .count(group.size())
                            .build();
                })));
    }

    private TreeMap<LocalDate, Double> dailyTotals(List<Reading> readings) {
        return readings.stream().collect(Collectors.groupingBy(
                r -> r.getTimestamp().toLocalDate(),
                TreeMap::new,
                Collectors.summingDouble(Reading::getWeightKg)));
    }

    /**
     * R² del ajuste, acotado a [0, 1]. Con un único día no hay ajuste posible y
     * se reporta 0; con totales constantes el ajuste es perfecto y se reporta 1.
     */
    private double rSquared(double[] ys, double slope, double intercept) {
        if (ys.length < 2) {
            return 0;
        }
        double meanY = mean(ys);
        double ssTot = 0;
        double ssRes = 0;
        for (int x = 0; x < ys.length; x++) {
            double fitted = intercept + slope * x;
            ssTot += (ys[x] - meanY) * (ys[x] - meanY);
            ssRes += (ys[x] - fitted) * (ys[x] - fitted);
        }
        if (ssTot == 0) {
            return ssRes == 0 ? 1 : 0;
        }
        return Math.max(0, Math.min(1, 1 - ssRes / ssTot));
    }

    private double percentChange(double current, double baseline) {
        return baseline > 0 ? (current - baseline) / baseline * 100 : 0;
    }

    private static double[] weights(List<Reading> readings) {
        return readings.stream().mapToDouble(Reading::getWeightKg).toArray();
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double populationStdDev(double[] values, double mean) {
        double sumSq = 0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSq / values.length);
    }

    private static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0
                ? (sorted[mid - 1] + sorted[mid]) / 2
                : sorted[mid];
    }
}
