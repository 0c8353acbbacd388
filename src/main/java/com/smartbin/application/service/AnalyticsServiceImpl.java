package com.smartbin.application.service;

import com.smartbin.domain.analytics.AggregateStats;
import com.smartbin.domain.analytics.Anomaly;
import com.smartbin.domain.analytics.Forecast;
import com.smartbin.domain.analytics.PatternAnalysis;
import com.smartbin.domain.analytics.PeriodComparison;
import com.smartbin.domain.analytics.StatsEngine;
import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.model.Reading;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.domain.port.ReadingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Implementación de la analítica sobre el repositorio de lecturas.
 */
@Service
@Slf4j
public class AnalyticsServiceImpl implements AnalyticsService {

    private final ReadingRepository readingRepository;
    private final Clock clock;
    private final StatsEngine statsEngine = new StatsEngine();

    public AnalyticsServiceImpl(ReadingRepository readingRepository, Clock clock) {
        this.readingRepository = readingRepository;
        this.clock = clock;
    }

    @Override
    public ServiceResult<AggregateStats> getStatistics(int days) {
        if (days < 1) {
            return invalidDays(days);
        }
        return statsEngine.aggregate(window(LocalDateTime.now(clock), days));
    }

    @Override
    public ServiceResult<PatternAnalysis> analyzePatterns(int days) {
        if (days < 1) {
            return invalidDays(days);
        }
        List<Reading> readings = window(LocalDateTime.now(clock), days);
        log.debug("Analizando patrones: {} lecturas en {} días", readings.size(), days);
        return statsEngine.analyzePatterns(readings, days);
    }

    @Override
    public ServiceResult<Forecast> forecast(int futureDays) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Reading> training = window(now, FORECAST_TRAINING_DAYS);
        ServiceResult<Forecast> result = statsEngine.forecast(training, futureDays, now);
        if (!result.isSuccess()) {
            log.info("Predicción no disponible ({} lecturas): {}", training.size(), result.getMessage());
        }
        return result;
    }

    @Override
    public ServiceResult<List<Anomaly>> detectAnomalies(double sensitivity) {
        if (sensitivity < 0 || Double.isNaN(sensitivity)) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "sensibilidade deve ser >= 0");
        }
        List<Reading> readings = window(LocalDateTime.now(clock), ANOMALY_WINDOW_DAYS);
        List<Anomaly> anomalies = statsEngine.detectAnomalies(readings, sensitivity);
        if (!anomalies.isEmpty()) {
            log.info("{} anomalías detectadas (k={})", anomalies.size(), sensitivity);
        }
        return ServiceResult.success(anomalies);
    }

    @Override
    public ServiceResult<PeriodComparison> comparePeriods(int currentDays, int previousDays) {
        if (currentDays < 1 || previousDays < 1) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "periodos devem ter ao menos um dia");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        return statsEngine.comparePeriods(window(now, currentDays + previousDays), currentDays, previousDays, now);
    }

    private List<Reading> window(LocalDateTime now, int days) {
        return readingRepository.findSince(now.minusDays(days));
    }

    private static <T> ServiceResult<T> invalidDays(int days) {
        return ServiceResult.failure(ErrorKind.VALIDATION, "dias deve ser >= 1, recebido: " + days);
    }
}
