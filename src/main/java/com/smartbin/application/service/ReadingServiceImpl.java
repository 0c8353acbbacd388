package com.smartbin.application.service;

import com.smartbin.application.dto.IngestReadingRequest;
import com.smartbin.application.dto.ReadingDto;
import com.smartbin.application.dto.ReadingSummaryDto;
import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.model.Reading;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.domain.port.ReadingRepository;
import com.smartbin.presentation.websocket.ReadingWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Implementación del servicio de lecturas.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReadingServiceImpl implements ReadingService {

    /** Dispositivo que figura en la auditoría de la ingesta */
    static final String DEVICE_ACTOR = "ESP32";
    static final String DEFAULT_LOCATION = "nao especificado";
    static final int MAX_LIMIT = 1000;

    private final ReadingRepository readingRepository;
    private final ReadingWebSocketHandler webSocketHandler;
    private final AuditService auditService;
    private final Clock clock;

    @Override
    public ServiceResult<ReadingDto> ingest(IngestReadingRequest request) {
        if (request == null || request.weightKg() == null || request.sensorId() == null
                || request.sensorId().isBlank()) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "Campos obrigatorios: peso_kg, sensor_id");
        }
        double weight = request.weightKg();
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "peso_kg deve ser um numero >= 0");
        }

        LocalDateTime timestamp;
        try {
            timestamp = parseTimestamp(request.timestamp());
        } catch (DateTimeParseException e) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "timestamp invalido: " + request.timestamp());
        }

        Reading reading = Reading.builder()
                .timestamp(timestamp)
                .weightKg(weight)
                .sensorId(request.sensorId())
                .temperature(request.temperature() != null ? request.temperature() : 0.0)
                .humidity(request.humidity() != null ? request.humidity() : 0.0)
                .location(request.location() != null && !request.location().isBlank()
                        ? request.location()
                        : DEFAULT_LOCATION)
                .source(Reading.SOURCE_API)
                .build();

        Reading saved = readingRepository.save(reading);
        ReadingDto dto = ReadingDto.fromDomain(saved);

        log.info("Lectura recibida: sensor={}, peso={} kg", saved.getSensorId(), saved.getWeightKg());
        auditService.success(DEVICE_ACTOR, AuditService.CREATE,
                "Leitura recebida do sensor " + saved.getSensorId());
        webSocketHandler.broadcastReading(dto);

        return ServiceResult.success(dto);
    }

    @Override
    public List<ReadingDto> getLatest(int limit, String sensorId) {
        int capped = Math.max(1, Math.min(limit, MAX_LIMIT));
        String filter = sensorId != null && !sensorId.isBlank() ? sensorId : null;
        return readingRepository.findLatest(capped, filter).stream()
                .map(ReadingDto::fromDomain)
                .collect(Collectors.toList());
    }

    @Override
    public ReadingSummaryDto getSummary(String sensorId) {
        String filter = sensorId != null && !sensorId.isBlank() ? sensorId : null;
        return ReadingSummaryDto.fromDomain(filter, readingRepository.summarize(filter));
    }

    @Override
    public List<String> getSensors() {
        return readingRepository.findDistinctSensorIds();
    }

    /**
     * Acepta ISO-8601 con o sin offset; los valores con offset se pasan a UTC.
     */
    private LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return LocalDateTime.now(clock);
        }
        String text = value.trim();
        try {
            return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text);
        }
    }
}
