package com.smartbin.domain.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Lectura cuyo peso supera el umbral media + k·σ.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly {

    private LocalDateTime timestamp;
    private double weightKg;
    private String sensorId;

    /** Desvíos estándar por encima de la media (0 si σ = 0) */
    private double stdDeviations;

    private Severity severity;
}
