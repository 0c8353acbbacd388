package com.smartbin.application.scheduler;

import com.smartbin.application.dto.ReadingDto;
import com.smartbin.domain.model.Reading;
import com.smartbin.domain.port.ReadingRepository;
import com.smartbin.domain.port.SensorFeedClient;
import com.smartbin.domain.port.SensorFeedClient.FeedEntry;
import com.smartbin.presentation.websocket.ReadingWebSocketHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Job programado que importa la última entrada del canal ThingSpeak como una
 * lectura. Una entrada cuyo timestamp externo ya fue importado se ignora.
 */
@Component
@ConditionalOnProperty(name = "thingspeak.enabled", havingValue = "true")
@Slf4j
public class ThingSpeakPollingJob {

    private final SensorFeedClient feedClient;
    private final ReadingRepository readingRepository;
    private final ReadingWebSocketHandler webSocketHandler;
    private final Clock clock;

    @Value("${thingspeak.sensor-id:esp32-lixeira-001}")
    private String sensorId;

    @Value("${thingspeak.location:entrada}")
    private String location;

    // --- Tracking de la última ejecución ---
    @Getter
    private LocalDateTime lastRunTime;
    @Getter
    private int importedCount;

    public ThingSpeakPollingJob(SensorFeedClient feedClient,
            ReadingRepository readingRepository,
            ReadingWebSocketHandler webSocketHandler,
            Clock clock) {
        this.feedClient = feedClient;
        this.readingRepository = readingRepository;
        this.webSocketHandler = webSocketHandler;
        this.clock = clock;
    }

    /**
     * Ejecuta un ciclo de importación.
     *
     * @return true si se guardó una lectura nueva
     */
    @Scheduled(fixedDelayString = "${thingspeak.poll-interval-ms:60000}")
    public boolean poll() {
        lastRunTime = LocalDateTime.now(clock);

        Optional<FeedEntry> latest = feedClient.fetchLatest();
        if (latest.isEmpty()) {
            log.debug("Sin entradas nuevas en ThingSpeak");
            return false;
        }

        FeedEntry entry = latest.get();
        if (readingRepository.existsByExternalTimestamp(entry.externalTimestamp())) {
            log.debug("Entrada ThingSpeak {} ya importada", entry.externalTimestamp());
            return false;
        }
        if (!Double.isFinite(entry.weightKg()) || entry.weightKg() < 0) {
            log.warn("Peso inválido ignorado desde ThingSpeak: {} kg ({})", entry.weightKg(),
                    entry.externalTimestamp());
            return false;
        }

        Reading saved = readingRepository.save(Reading.builder()
                .timestamp(toUtc(entry.externalTimestamp()))
                .weightKg(entry.weightKg())
                .sensorId(sensorId)
                .location(location)
                .source(Reading.SOURCE_THINGSPEAK)
                .externalTimestamp(entry.externalTimestamp())
                .build());
        importedCount++;

        log.info("Lectura importada de ThingSpeak: {} kg ({})", saved.getWeightKg(), entry.externalTimestamp());
        webSocketHandler.broadcastReading(ReadingDto.fromDomain(saved));
        return true;
    }

    private LocalDateTime toUtc(String externalTimestamp) {
        try {
            return OffsetDateTime.parse(externalTimestamp).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.warn("Timestamp de ThingSpeak no reconocido '{}', se usa la hora actual", externalTimestamp);
            return LocalDateTime.now(clock);
        }
    }
}
