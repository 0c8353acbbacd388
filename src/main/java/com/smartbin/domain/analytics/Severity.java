package com.smartbin.domain.analytics;

/**
 * Severidad de una anomalía de peso.
 */
public enum Severity {

    CRITICAL("Crítica"),

    HIGH("Alta");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
