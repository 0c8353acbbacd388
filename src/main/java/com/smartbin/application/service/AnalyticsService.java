package com.smartbin.application.service;

import com.smartbin.domain.analytics.AggregateStats;
import com.smartbin.domain.analytics.Anomaly;
import com.smartbin.domain.analytics.Forecast;
import com.smartbin.domain.analytics.PatternAnalysis;
import com.smartbin.domain.analytics.PeriodComparison;
import com.smartbin.domain.model.ServiceResult;

import java.util.List;

/**
 * Servicio de analítica sobre las lecturas almacenadas. Cada operación carga
 * su ventana de tiempo y delega el cálculo en el motor estadístico.
 */
public interface AnalyticsService {

    /** Ventana de entrenamiento de la predicción, en días */
    int FORECAST_TRAINING_DAYS = 90;

    /** Ventana de la detección de anomalías, en días */
    int ANOMALY_WINDOW_DAYS = 30;

    ServiceResult<AggregateStats> getStatistics(int days);

    ServiceResult<PatternAnalysis> analyzePatterns(int days);

    /**
     * Predice el total diario de los próximos días.
     *
     * @param futureDays Días a predecir
     * @return la predicción, VALIDATION o INSUFFICIENT_DATA
     */
    ServiceResult<Forecast> forecast(int futureDays);

    /**
     * Detecta anomalías en los últimos 30 días.
     *
     * @param sensitivity Factor k sobre el desvío estándar (>= 0)
     * @return anomalías, la más reciente primero, o VALIDATION
     */
    ServiceResult<List<Anomaly>> detectAnomalies(double sensitivity);

    ServiceResult<PeriodComparison> comparePeriods(int currentDays, int previousDays);
}
