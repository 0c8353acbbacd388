package com.smartbin.infrastructure.persistence;

import com.smartbin.domain.model.AuditLogEntry;
import com.smartbin.domain.model.AuditStatus;
import com.smartbin.domain.port.AuditLogRepository;
import com.smartbin.infrastructure.persistence.entity.AuditLogEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Implementación del puerto AuditLogRepository usando JPA.
 */
@Component
@RequiredArgsConstructor
public class AuditLogRepositoryImpl implements AuditLogRepository {

    private final JpaAuditLogRepository jpaRepository;

    @Override
    @Transactional
    public void append(AuditLogEntry entry) {
        jpaRepository.save(AuditLogEntity.builder()
                .timestamp(entry.getTimestamp())
                .username(entry.getUsername())
                .action(entry.getAction())
                .description(entry.getDescription())
                .status(entry.getStatus().getCode())
                .sensitiveData(entry.isSensitiveData())
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditLogEntry> findRecent(String username, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<AuditLogEntity> entities = username == null || username.isBlank()
                ? jpaRepository.findAllByOrderByTimestampDesc(page)
                : jpaRepository.findByUsernameOrderByTimestampDesc(username, page);

        return entities.stream()
                .map(entity -> AuditLogEntry.builder()
                        .timestamp(entity.getTimestamp())
                        .username(entity.getUsername())
                        .action(entity.getAction())
                        .description(entity.getDescription())
                        .status(AuditStatus.fromCode(entity.getStatus()))
                        .sensitiveData(Boolean.TRUE.equals(entity.getSensitiveData()))
                        .build())
                .collect(Collectors.toList());
    }
}
