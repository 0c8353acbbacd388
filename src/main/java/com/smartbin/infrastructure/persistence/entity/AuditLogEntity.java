package com.smartbin.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla auditoria.
 */
@Entity
@Table(name = "auditoria", indexes = {
        @Index(name = "idx_auditoria_data_hora", columnList = "data_hora"),
        @Index(name = "idx_auditoria_usuario", columnList = "usuario")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "data_hora", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    @Column(name = "usuario", length = 100, updatable = false)
    private String username;

    @Column(name = "acao", nullable = false, length = 50, updatable = false)
    private String action;

    @Column(name = "descricao", length = 500, updatable = false)
    private String description;

    @Column(name = "status", nullable = false, length = 10, updatable = false)
    private String status;

    @Column(name = "dados_sensiveis", nullable = false, updatable = false)
    private Boolean sensitiveData;
}
