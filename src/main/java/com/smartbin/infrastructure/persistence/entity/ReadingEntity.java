package com.smartbin.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla leituras.
 */
@Entity
@Table(name = "leituras", indexes = {
        @Index(name = "idx_leituras_data_hora", columnList = "data_hora"),
        @Index(name = "idx_leituras_sensor", columnList = "sensor_id"),
        @Index(name = "idx_leituras_timestamp_externo", columnList = "timestamp_externo")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "data_hora", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "peso_kg", nullable = false)
    private Double weightKg;

    @Column(name = "sensor_id", nullable = false, length = 100)
    private String sensorId;

    @Column(name = "temperatura")
    private Double temperature;

    @Column(name = "umidade")
    private Double humidity;

    @Column(name = "localizacao", length = 150)
    private String location;

    @Column(name = "fonte", length = 30)
    private String source;

    @Column(name = "timestamp_externo", length = 50)
    private String externalTimestamp;
}
