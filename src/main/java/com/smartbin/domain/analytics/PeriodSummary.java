package com.smartbin.domain.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Totales de un período de comparación.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodSummary {

    private int days;
    private double totalKg;

    /** Media por lectura, 0 si el período no tiene lecturas */
    private double meanKg;

    private int count;
}
