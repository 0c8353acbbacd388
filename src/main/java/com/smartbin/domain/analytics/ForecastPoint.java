package com.smartbin.domain.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Predicción para un día futuro.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastPoint {

    /** Día relativo (1 = mañana) */
    private int day;

    /** Peso diario previsto, nunca negativo */
    private double predictedKg;

    private LocalDateTime estimatedDate;
}
