package com.smartbin.application.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartbin.domain.model.Reading;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;

/**
 * DTO para transferir lecturas a la capa de presentación. Mantiene los nombres
 * de campo que usan los sensores y el dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReadingDto {

    private Long id;

    private String timestamp;

    @JsonProperty("peso_kg")
    private double weightKg;

    @JsonProperty("sensor_id")
    private String sensorId;

    @JsonProperty("temperatura")
    private double temperature;

    @JsonProperty("umidade")
    private double humidity;

    @JsonProperty("localizacao")
    private String location;

    @JsonProperty("fonte")
    private String source;

    /**
     * Crea un DTO desde un modelo de dominio.
     */
    public static ReadingDto fromDomain(Reading reading) {
        return ReadingDto.builder()
                .id(reading.getId())
                .timestamp(reading.getTimestamp() != null
                        ? reading.getTimestamp().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                        : null)
                .weightKg(reading.getWeightKg())
                .sensorId(reading.getSensorId())
                .temperature(reading.getTemperature())
                .humidity(reading.getHumidity())
                .location(reading.getLocation())
                .source(reading.getSource())
                .build();
    }
}
