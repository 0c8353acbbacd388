package com.smartbin.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Registro de auditoría de una acción sensible. Solo se agrega, nunca se
 * modifica.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntry {

    private LocalDateTime timestamp;

    /** Usuario (o dispositivo) que realizó la acción */
    private String username;

    /** Tipo de acción (LOGIN, CREATE, READ, ANALYZE, EXPORT, ...) */
    private String action;

    private String description;

    private AuditStatus status;

    /** Indica si la acción involucra datos sensibles */
    private boolean sensitiveData;
}
