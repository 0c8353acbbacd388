package com.smartbin.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cuerpo de la petición de ingesta enviada por los sensores.
 *
 * @param weightKg    peso en kg (obligatorio, >= 0)
 * @param sensorId    identificador del sensor (obligatorio)
 * @param temperature temperatura opcional
 * @param humidity    humedad opcional
 * @param location    ubicación opcional
 * @param timestamp   ISO-8601 opcional; por defecto el instante actual en UTC
 */
public record IngestReadingRequest(
        @JsonProperty("peso_kg") Double weightKg,
        @JsonProperty("sensor_id") String sensorId,
        @JsonProperty("temperatura") Double temperature,
        @JsonProperty("umidade") Double humidity,
        @JsonProperty("localizacao") String location,
        @JsonProperty("timestamp") String timestamp) {
}
