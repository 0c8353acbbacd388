package com.smartbin.application.dto;

import com.smartbin.domain.model.AuditLogEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;

/**
 * DTO de un registro de auditoría.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogDto {

    private String timestamp;
    private String username;
    private String action;
    private String description;
    private String status;
    private boolean sensitiveData;

    public static AuditLogDto fromDomain(AuditLogEntry entry) {
        return AuditLogDto.builder()
                .timestamp(entry.getTimestamp() != null
                        ? entry.getTimestamp().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                        : null)
                .username(entry.getUsername())
                .action(entry.getAction())
                .description(entry.getDescription())
                .status(entry.getStatus() != null ? entry.getStatus().getCode() : null)
                .sensitiveData(entry.isSensitiveData())
                .build();
    }
}
