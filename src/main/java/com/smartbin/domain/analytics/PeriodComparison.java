package com.smartbin.domain.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Comparación entre el período más reciente y el período anterior.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodComparison {

    /** Últimos N días */
    private PeriodSummary current;

    /** Los M días previos al período actual */
    private PeriodSummary previous;

    /** Variación porcentual del total, 0 si el total previo es 0 */
    private double totalChangePercent;

    /** Variación porcentual de la media, 0 si la media previa es 0 */
    private double meanChangePercent;

    private Tendency tendency;
}
