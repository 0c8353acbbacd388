package com.smartbin.infrastructure.persistence;

import com.smartbin.infrastructure.persistence.entity.ReadingEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repositorio JPA para operaciones con leituras.
 */
@Repository
public interface JpaReadingRepository extends JpaRepository<ReadingEntity, Long> {

    /**
     * Busca lecturas desde una fecha, la más antigua primero.
     */
    List<ReadingEntity> findByTimestampGreaterThanEqualOrderByTimestampAsc(LocalDateTime cutoff);

    /**
     * Busca las últimas lecturas de todos los sensores.
     */
    List<ReadingEntity> findAllByOrderByTimestampDesc(Pageable pageable);

    /**
     * Busca las últimas lecturas de un sensor.
     */
    List<ReadingEntity> findBySensorIdOrderByTimestampDesc(String sensorId, Pageable pageable);

    @Query("SELECT DISTINCT r.sensorId FROM ReadingEntity r ORDER BY r.sensorId")
    List<String> findDistinctSensorIds();

    boolean existsByExternalTimestamp(String externalTimestamp);

    /**
     * Agregados sobre todas las lecturas, o solo las del sensor indicado.
     */
    @Query("SELECT AVG(r.weightKg) AS averageWeight, SUM(r.weightKg) AS totalWeight, "
            + "MAX(r.weightKg) AS maxWeight, MIN(r.weightKg) AS minWeight, "
            + "AVG(r.temperature) AS averageTemperature, AVG(r.humidity) AS averageHumidity, "
            + "COUNT(r) AS readingCount "
            + "FROM ReadingEntity r WHERE (:sensorId IS NULL OR r.sensorId = :sensorId)")
    ReadingAggregateView aggregate(@Param("sensorId") String sensorId);

    /**
     * Proyección de los agregados. Los valores son null cuando no hay lecturas.
     */
    interface ReadingAggregateView {
        Double getAverageWeight();

        Double getTotalWeight();

        Double getMaxWeight();

        Double getMinWeight();

        Double getAverageTemperature();

        Double getAverageHumidity();

        Long getReadingCount();
    }
}
