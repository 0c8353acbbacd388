package com.smartbin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Smart Bin Monitor - Aplicación Principal
 *
 * Backend de lixeiras inteligentes con:
 * - Ingesta de lecturas de peso desde sensores ESP32 y ThingSpeak
 * - Estadísticas, predicción lineal y detección de anomalías
 * - Autenticación con segundo factor TOTP y auditoría
 * - Feed de lecturas en tiempo real via WebSocket
 */
@SpringBootApplication
@EnableScheduling
public class SmartBinApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmartBinApplication.class, args);
    }
}
