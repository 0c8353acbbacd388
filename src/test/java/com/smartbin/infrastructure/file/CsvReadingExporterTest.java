package com.smartbin.infrastructure.file;

import com.smartbin.domain.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CsvReadingExporter}.
 */
class CsvReadingExporterTest {

    private final CsvReadingExporter exporter = new CsvReadingExporter();

    @Test
    @DisplayName("Should write the header and one unquoted row per reading")
    void shouldExportRows() {
        Reading reading = Reading.builder()
                .timestamp(LocalDateTime.of(2024, 3, 15, 12, 30, 5))
                .sensorId("esp32-lixeira-001")
                .weightKg(3.25)
                .temperature(24.5)
                .humidity(61.0)
                .build();

        String csv = exporter.export(List.of(reading));

        assertThat(csv).isEqualTo("timestamp,sensor_id,peso_kg,temperatura,umidade\n"
                + "2024-03-15T12:30:05,esp32-lixeira-001,3.25,24.5,61.0\n");
    }

    @Test
    @DisplayName("Should write only the header when there are no readings")
    void shouldExportHeaderOnly() {
        assertThat(exporter.export(List.of())).isEqualTo("timestamp,sensor_id,peso_kg,temperatura,umidade\n");
    }
}
