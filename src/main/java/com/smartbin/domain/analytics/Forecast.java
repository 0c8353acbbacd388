package com.smartbin.domain.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Resultado de la regresión lineal sobre totales diarios.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Forecast {

    private String model;

    /** Cantidad de días con datos usados en el ajuste */
    private int trainingDays;

    private double slope;
    private double intercept;
    private double rSquared;
    private Confidence confidence;
    private List<ForecastPoint> predictions;
}
