package com.smartbin.presentation.controller;

import com.smartbin.application.dto.IngestReadingRequest;
import com.smartbin.application.dto.ReadingDto;
import com.smartbin.application.service.AuditService;
import com.smartbin.application.service.AuthorizationService;
import com.smartbin.application.service.ReadingService;
import com.smartbin.domain.model.Permission;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.presentation.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Ingesta de lecturas de sensores y consultas sobre ellas.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ReadingController {

    private final ReadingService readingService;
    private final AuthorizationService authorizationService;
    private final AuditService auditService;

    /**
     * POST /api/dados
     * Endpoint público usado por los sensores.
     */
    @PostMapping("/dados")
    public ResponseEntity<Map<String, Object>> ingest(@RequestBody IngestReadingRequest request) {
        ServiceResult<ReadingDto> result = readingService.ingest(request);
        if (!result.isSuccess()) {
            return ApiResponses.failure(result.getError(), result.getMessage());
        }

        Map<String, Object> response = ApiResponses.body(true);
        response.put("message", "Dados recebidos com sucesso");
        response.put("reading", result.getValue());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * GET /api/leituras?limite=100&sensor_id=...
     */
    @GetMapping("/leituras")
    public ResponseEntity<Map<String, Object>> latest(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username,
            @RequestParam(name = "limite", defaultValue = "100") int limit,
            @RequestParam(name = "sensor_id", required = false) String sensorId) {
        authorizationService.requirePermission(username, Permission.READ);

        List<ReadingDto> readings = readingService.getLatest(limit, sensorId);
        auditService.success(username, AuditService.READ, "Consultou " + readings.size() + " leituras");

        Map<String, Object> response = ApiResponses.body(true);
        response.put("total", readings.size());
        response.put("readings", readings);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/estatisticas?sensor_id=...
     */
    @GetMapping("/estatisticas")
    public ResponseEntity<Map<String, Object>> summary(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username,
            @RequestParam(name = "sensor_id", required = false) String sensorId) {
        authorizationService.requirePermission(username, Permission.READ);
        return ApiResponses.ok("statistics", readingService.getSummary(sensorId));
    }

    /**
     * GET /api/sensores
     */
    @GetMapping("/sensores")
    public ResponseEntity<Map<String, Object>> sensors(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username) {
        authorizationService.requirePermission(username, Permission.READ);

        List<String> sensors = readingService.getSensors();
        Map<String, Object> response = ApiResponses.body(true);
        response.put("total", sensors.size());
        response.put("sensors", sensors);
        return ResponseEntity.ok(response);
    }
}
