package com.smartbin.application.service;

import com.smartbin.application.dto.IngestReadingRequest;
import com.smartbin.application.dto.ReadingDto;
import com.smartbin.application.dto.ReadingSummaryDto;
import com.smartbin.domain.model.ServiceResult;

import java.util.List;

/**
 * Servicio de ingesta y consulta de lecturas.
 */
public interface ReadingService {

    /**
     * Valida y guarda una lectura enviada por un sensor, y la notifica a los
     * clientes WebSocket.
     *
     * @param request Cuerpo recibido
     * @return la lectura guardada, o VALIDATION
     */
    ServiceResult<ReadingDto> ingest(IngestReadingRequest request);

    /**
     * Obtiene las lecturas más recientes.
     *
     * @param limit    Número máximo
     * @param sensorId Sensor a filtrar (opcional)
     * @return Lecturas, la más reciente primero
     */
    List<ReadingDto> getLatest(int limit, String sensorId);

    ReadingSummaryDto getSummary(String sensorId);

    List<String> getSensors();
}
