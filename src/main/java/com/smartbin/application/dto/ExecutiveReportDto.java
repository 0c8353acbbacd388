package com.smartbin.application.dto;

import com.smartbin.domain.analytics.Anomaly;
import com.smartbin.domain.analytics.Forecast;
import com.smartbin.domain.analytics.PatternAnalysis;
import com.smartbin.domain.analytics.PeriodComparison;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Reporte ejecutivo con todas las análisis. Las secciones sin datos quedan en
 * null y su motivo se informa en {@code unavailable}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutiveReportDto {

    private String generatedAt;
    private String title;
    private PatternAnalysis patterns;
    private Forecast forecast;
    private List<Anomaly> anomalies;
    private PeriodComparison comparison;
    private List<String> recommendations;

    /** Sección → motivo por el cual no se pudo calcular */
    private Map<String, String> unavailable;
}
