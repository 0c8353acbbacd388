package com.smartbin.domain.analytics;

/**
 * Tendencia entre dos períodos consecutivos.
 */
public enum Tendency {

    INCREASE("Aumento"),

    DECREASE("Redução");

    private final String label;

    Tendency(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
