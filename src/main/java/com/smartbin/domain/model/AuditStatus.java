package com.smartbin.domain.model;

/**
 * Resultado de una acción auditada.
 */
public enum AuditStatus {

    SUCESSO("sucesso"),

    ERRO("erro");

    private final String code;

    AuditStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static AuditStatus fromCode(String code) {
        return "erro".equalsIgnoreCase(code) ? ERRO : SUCESSO;
    }
}
