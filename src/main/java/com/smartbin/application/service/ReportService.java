package com.smartbin.application.service;

import com.smartbin.application.dto.ExecutiveReportDto;
import com.smartbin.domain.analytics.Anomaly;
import com.smartbin.domain.analytics.Forecast;
import com.smartbin.domain.analytics.PatternAnalysis;
import com.smartbin.domain.analytics.PeriodComparison;
import com.smartbin.domain.analytics.StatsEngine;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.domain.port.ReadingRepository;
import com.smartbin.infrastructure.file.CsvReadingExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Genera el reporte ejecutivo y la exportación CSV de lecturas.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    static final String TITLE = "Relatório Executivo - Geração de Resíduos";
    static final String ALL_NORMAL = "Sistema operando dentro dos padrões";
    static final int PATTERN_DAYS = 30;
    static final int FORECAST_DAYS = 7;
    static final int COMPARISON_DAYS = 7;
    static final int CSV_MAX_ROWS = 1000;

    private final AnalyticsService analyticsService;
    private final ReadingRepository readingRepository;
    private final CsvReadingExporter csvExporter;
    private final Clock clock;

    /**
     * Reúne patrones (30 días), predicción (7 días), anomalías, comparación
     * (7 vs 7 días) y recomendaciones.
     */
    public ExecutiveReportDto generateExecutiveReport() {
        Map<String, String> unavailable = new LinkedHashMap<>();

        PatternAnalysis patterns = valueOrNote(analyticsService.analyzePatterns(PATTERN_DAYS), "padroes", unavailable);
        Forecast forecast = valueOrNote(analyticsService.forecast(FORECAST_DAYS), "predicoes", unavailable);
        List<Anomaly> anomalies = valueOrNote(
                analyticsService.detectAnomalies(StatsEngine.DEFAULT_SENSITIVITY), "anomalias", unavailable);
        PeriodComparison comparison = valueOrNote(
                analyticsService.comparePeriods(COMPARISON_DAYS, COMPARISON_DAYS), "comparacao", unavailable);

        log.info("Reporte ejecutivo generado ({} secciones sin datos)", unavailable.size());

        return ExecutiveReportDto.builder()
                .generatedAt(LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                .title(TITLE)
                .patterns(patterns)
                .forecast(forecast)
                .anomalies(anomalies != null ? anomalies : List.of())
                .comparison(comparison)
                .recommendations(recommendations(patterns, anomalies))
                .unavailable(unavailable)
                .build();
    }

    /**
     * Exporta las últimas 1000 lecturas, la más reciente primero.
     */
    public String exportCsv() {
        return csvExporter.export(readingRepository.findLatest(CSV_MAX_ROWS, null));
    }

    List<String> recommendations(PatternAnalysis patterns, List<Anomaly> anomalies) {
        List<String> result = new ArrayList<>();
        if (patterns != null) {
            result.add("Reforçar coleta às " + patterns.getPeakHour() + "h (horário de pico)");
        }
        if (anomalies != null && !anomalies.isEmpty()) {
            result.add("Investigar " + anomalies.size() + " anomalias detectadas");
        }
        if (result.isEmpty()) {
            result.add(ALL_NORMAL);
        }
        return result;
    }

    private static <T> T valueOrNote(ServiceResult<T> result, String section, Map<String, String> unavailable) {
        if (result.isSuccess()) {
            return result.getValue();
        }
        unavailable.put(section, result.getMessage());
        return null;
    }
}
