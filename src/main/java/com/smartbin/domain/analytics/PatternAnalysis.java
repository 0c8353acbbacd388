package com.smartbin.domain.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Patrones de generación de residuos en una ventana de días.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternAnalysis {

    private int days;
    private AggregateStats stats;

    /** Media de los totales diarios */
    private double dailyMean;

    private Map<Integer, BucketStats> byHour;
    private Map<DayOfWeek, BucketStats> byWeekday;

    /** Hora del día (0-23) con mayor peso acumulado */
    private int peakHour;

    /** Día con mayor peso acumulado */
    private LocalDate peakDay;

    private double meanTemperature;
    private double meanHumidity;
    private List<String> sensors;
}
