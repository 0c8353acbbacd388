package com.smartbin.domain.analytics;

/**
 * Nivel de confianza de una predicción, derivado del R² del ajuste.
 */
public enum Confidence {

    HIGH("Alta"),

    MEDIUM("Média"),

    LOW("Baixa");

    private final String label;

    Confidence(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Alta si R² > 0.7, Média si R² > 0.4, si no Baixa.
     */
    public static Confidence fromRSquared(double rSquared) {
        if (rSquared > 0.7) {
            return HIGH;
        }
        if (rSquared > 0.4) {
            return MEDIUM;
        }
        return LOW;
    }
}
