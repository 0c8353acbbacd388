package com.smartbin.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Modelo de dominio que representa una lectura de peso enviada por un sensor
 * de lixeira. Las lecturas son inmutables una vez ingeridas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reading {

    /** Fuente por defecto de las lecturas recibidas via API */
    public static final String SOURCE_API = "api";

    /** Fuente de las lecturas importadas desde ThingSpeak */
    public static final String SOURCE_THINGSPEAK = "thingspeak";

    /** Identificador único de la lectura */
    private Long id;

    /** Momento de la lectura (UTC) */
    private LocalDateTime timestamp;

    /** Peso medido en kilogramos (siempre >= 0) */
    private double weightKg;

    /** Identificador del sensor que envió la lectura */
    private String sensorId;

    /** Temperatura ambiente reportada por el sensor */
    private double temperature;

    /** Humedad relativa reportada por el sensor */
    private double humidity;

    /** Ubicación física de la lixeira */
    private String location;

    /** Origen de la lectura (api, thingspeak) */
    private String source;

    /** Timestamp original del feed externo, usado para evitar duplicados */
    private String externalTimestamp;
}
