package com.smartbin.application.service;

import com.smartbin.application.dto.AuditLogDto;
import com.smartbin.domain.model.AuditLogEntry;
import com.smartbin.domain.model.AuditStatus;
import com.smartbin.domain.port.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Servicio de auditoría. El registro es best-effort: una falla al escribir se
 * loguea y nunca cambia el resultado de la acción auditada.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    static final int MAX_QUERY_LIMIT = 1000;

    public static final String LOGIN = "LOGIN";
    public static final String LOGOUT = "LOGOUT";
    public static final String CREATE = "CREATE";
    public static final String READ = "READ";
    public static final String ANALYZE = "ANALYZE";
    public static final String EXPORT = "EXPORT";
    public static final String CREATE_USER = "CREATE_USER";
    public static final String DELETE_USER = "DELETE_USER";
    public static final String CHANGE_PASSWORD = "CHANGE_PASSWORD";
    public static final String ACCESS_DENIED = "ACCESS_DENIED";
    public static final String MFA_SETUP = "MFA_SETUP";
    public static final String MFA_ACTIVATED = "MFA_ATIVADO";
    public static final String MFA_ACTIVATION = "MFA_ATIVACAO";
    public static final String MFA_VERIFICATION = "MFA_VERIFICACAO";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public void success(String username, String action, String description) {
        record(username, action, description, AuditStatus.SUCESSO, false);
    }

    public void failure(String username, String action, String description) {
        record(username, action, description, AuditStatus.ERRO, false);
    }

    /**
     * Registra una acción.
     *
     * @param username    Usuario o dispositivo que actuó
     * @param action      Tipo de acción
     * @param description Descripción legible
     * @param status      Resultado de la acción
     * @param sensitive   Si la acción toca datos sensibles
     */
    public void record(String username, String action, String description, AuditStatus status, boolean sensitive) {
        AuditLogEntry entry = AuditLogEntry.builder()
                .timestamp(LocalDateTime.now(clock))
                .username(username)
                .action(action)
                .description(description)
                .status(status)
                .sensitiveData(sensitive)
                .build();
        try {
            auditLogRepository.append(entry);
        } catch (RuntimeException e) {
            log.error("No se pudo registrar auditoría {} de {}: {}", action, username, e.getMessage());
        }
    }

    /**
     * Consulta los registros más recientes.
     *
     * @param username Filtro opcional por usuario
     * @param limit    Número máximo, acotado a [1, 1000]
     * @return Registros, el más reciente primero
     */
    public List<AuditLogDto> findRecent(String username, int limit) {
        int capped = Math.max(1, Math.min(limit, MAX_QUERY_LIMIT));
        String filter = username != null && !username.isBlank() ? username : null;
        return auditLogRepository.findRecent(filter, capped).stream()
                .map(AuditLogDto::fromDomain)
                .collect(Collectors.toList());
    }
}
