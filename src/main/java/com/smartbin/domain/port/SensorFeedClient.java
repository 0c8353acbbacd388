package com.smartbin.domain.port;

import java.util.Optional;

/**
 * Puerto para leer la última entrada de un feed externo de sensores.
 */
public interface SensorFeedClient {

    /**
     * Obtiene la última entrada publicada.
     *
     * @return Optional vacío si el feed no tiene entradas o no respondió
     */
    Optional<FeedEntry> fetchLatest();

    /**
     * Entrada de feed: valor de peso y timestamp reportado por el proveedor.
     */
    record FeedEntry(double weightKg, String externalTimestamp, String channelId) {
    }
}
