package com.smartbin.application.dto;

import com.smartbin.domain.port.ReadingRepository.ReadingSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO con los agregados globales de lecturas, redondeados a 2 decimales.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadingSummaryDto {

    /** Sensor filtrado, o "todos" */
    private String sensorFilter;

    private double averageWeight;
    private double totalWeight;
    private double maxWeight;
    private double minWeight;
    private double averageTemperature;
    private double averageHumidity;
    private long readingCount;

    public static ReadingSummaryDto fromDomain(String sensorFilter, ReadingSummary summary) {
        return ReadingSummaryDto.builder()
                .sensorFilter(sensorFilter != null && !sensorFilter.isBlank() ? sensorFilter : "todos")
                .averageWeight(round(summary.averageWeight()))
                .totalWeight(round(summary.totalWeight()))
                .maxWeight(round(summary.maxWeight()))
                .minWeight(round(summary.minWeight()))
                .averageTemperature(round(summary.averageTemperature()))
                .averageHumidity(round(summary.averageHumidity()))
                .readingCount(summary.count())
                .build();
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
