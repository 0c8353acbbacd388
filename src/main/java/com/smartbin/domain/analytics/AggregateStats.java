package com.smartbin.domain.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Estadísticas agregadas sobre el peso de un conjunto de lecturas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregateStats {

    private double total;
    private double mean;
    private double max;
    private double min;

    /** Desvío estándar poblacional (divide por N) */
    private double stdDev;

    private double median;
    private int count;
}
