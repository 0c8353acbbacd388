package com.smartbin.infrastructure.persistence;

import com.smartbin.domain.model.Reading;
import com.smartbin.domain.port.ReadingRepository;
import com.smartbin.infrastructure.persistence.entity.ReadingEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Implementación del puerto ReadingRepository usando JPA.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReadingRepositoryImpl implements ReadingRepository {

    private final JpaReadingRepository jpaRepository;

    @Override
    @Transactional
    public Reading save(Reading reading) {
        ReadingEntity saved = jpaRepository.save(toEntity(reading));
        log.debug("Lectura guardada: id={}, sensor={}", saved.getId(), saved.getSensorId());
        return toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Reading> findSince(LocalDateTime cutoff) {
        return jpaRepository.findByTimestampGreaterThanEqualOrderByTimestampAsc(cutoff)
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Reading> findLatest(int limit, String sensorId) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<ReadingEntity> entities = sensorId == null || sensorId.isBlank()
                ? jpaRepository.findAllByOrderByTimestampDesc(page)
                : jpaRepository.findBySensorIdOrderByTimestampDesc(sensorId, page);

        return entities.stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findDistinctSensorIds() {
        return jpaRepository.findDistinctSensorIds();
    }

    @Override
    public ReadingSummary summarize(String sensorId) {
        String filter = sensorId == null || sensorId.isBlank() ? null : sensorId;
        JpaReadingRepository.ReadingAggregateView view = jpaRepository.aggregate(filter);

        if (view == null || view.getReadingCount() == null || view.getReadingCount() == 0) {
            return ReadingSummary.empty();
        }

        return new ReadingSummary(
                orZero(view.getAverageWeight()),
                orZero(view.getTotalWeight()),
                orZero(view.getMaxWeight()),
                orZero(view.getMinWeight()),
                orZero(view.getAverageTemperature()),
                orZero(view.getAverageHumidity()),
                view.getReadingCount());
    }

    @Override
    public boolean existsByExternalTimestamp(String externalTimestamp) {
        return jpaRepository.existsByExternalTimestamp(externalTimestamp);
    }

    /**
     * Convierte una lectura de dominio a una entidad JPA.
     */
    private ReadingEntity toEntity(Reading reading) {
        return ReadingEntity.builder()
                .timestamp(reading.getTimestamp())
                .weightKg(reading.getWeightKg())
                .sensorId(reading.getSensorId())
                .temperature(reading.getTemperature())
                .humidity(reading.getHumidity())
                .location(reading.getLocation())
                .source(reading.getSource())
                .externalTimestamp(reading.getExternalTimestamp())
                .build();
    }

    /**
     * Convierte una entidad JPA a una lectura de dominio.
     */
    private Reading toDomain(ReadingEntity entity) {
        return Reading.builder()
                .id(entity.getId())
                .timestamp(entity.getTimestamp())
                .weightKg(orZero(entity.getWeightKg()))
                .sensorId(entity.getSensorId())
                .temperature(orZero(entity.getTemperature()))
                .humidity(orZero(entity.getHumidity()))
                .location(entity.getLocation())
                .source(entity.getSource())
                .externalTimestamp(entity.getExternalTimestamp())
                .build();
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
