package com.smartbin.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Papeles de usuario reconocidos por el sistema.
 */
public enum Role {

    /** Administrador: acceso total, gestión de usuarios y auditoría */
    ADMIN("admin"),

    /** Gestor: consulta, análisis y exportación */
    GESTOR("gestor"),

    /** Usuario: solo lectura */
    USUARIO("usuario");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    /**
     * Código usado en persistencia y en la API.
     */
    public String getCode() {
        return code;
    }

    /**
     * Resuelve un papel a partir de su código (sin distinguir mayúsculas).
     *
     * @param code Código del papel ("admin", "gestor", "usuario")
     * @return Optional con el papel si el código es válido
     */
    public static Optional<Role> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(role -> role.code.equals(normalized))
                .findFirst();
    }
}
