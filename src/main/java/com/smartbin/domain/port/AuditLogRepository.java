package com.smartbin.domain.port;

import com.smartbin.domain.model.AuditLogEntry;

import java.util.List;

/**
 * Puerto (interfaz) para el registro de auditoría. Solo permite agregar y
 * consultar.
 */
public interface AuditLogRepository {

    void append(AuditLogEntry entry);

    /**
     * Busca los registros más recientes.
     *
     * @param username Usuario a filtrar, o null para todos
     * @param limit    Número máximo de registros
     * @return Registros, el más reciente primero
     */
    List<AuditLogEntry> findRecent(String username, int limit);
}
