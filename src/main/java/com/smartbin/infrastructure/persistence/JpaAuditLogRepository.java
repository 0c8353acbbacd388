package com.smartbin.infrastructure.persistence;

import com.smartbin.infrastructure.persistence.entity.AuditLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repositorio JPA para operaciones con auditoria.
 */
@Repository
public interface JpaAuditLogRepository extends JpaRepository<AuditLogEntity, Long> {

    List<AuditLogEntity> findAllByOrderByTimestampDesc(Pageable pageable);

    List<AuditLogEntity> findByUsernameOrderByTimestampDesc(String username, Pageable pageable);
}
