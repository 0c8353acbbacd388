package com.smartbin.domain.port;

import com.smartbin.domain.model.Reading;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Puerto (interfaz) para la persistencia de lecturas de sensores.
 */
public interface ReadingRepository {

    /**
     * Guarda una lectura nueva.
     *
     * @param reading Lectura a guardar
     * @return Lectura guardada con su identificador
     */
    Reading save(Reading reading);

    /**
     * Busca las lecturas con timestamp >= cutoff, en orden ascendente.
     *
     * @param cutoff Inicio de la ventana
     * @return Lecturas de la ventana, la más antigua primero
     */
    List<Reading> findSince(LocalDateTime cutoff);

    /**
     * Busca las lecturas más recientes, opcionalmente de un solo sensor.
     *
     * @param limit    Número máximo de lecturas
     * @param sensorId Sensor a filtrar, o null para todos
     * @return Lecturas, la más reciente primero
     */
    List<Reading> findLatest(int limit, String sensorId);

    /**
     * Obtiene los identificadores distintos de sensores.
     */
    List<String> findDistinctSensorIds();

    /**
     * Calcula los agregados de todas las lecturas, opcionalmente de un sensor.
     *
     * @param sensorId Sensor a filtrar, o null para todos
     * @return Resumen (con ceros si no hay lecturas)
     */
    ReadingSummary summarize(String sensorId);

    /**
     * Verifica si ya existe una lectura importada con el timestamp externo dado.
     */
    boolean existsByExternalTimestamp(String externalTimestamp);

    /**
     * Agregados globales sobre las lecturas.
     */
    record ReadingSummary(
            double averageWeight,
            double totalWeight,
            double maxWeight,
            double minWeight,
            double averageTemperature,
            double averageHumidity,
            long count) {

        public static ReadingSummary empty() {
            return new ReadingSummary(0, 0, 0, 0, 0, 0, 0);
        }
    }
}
