package com.smartbin.presentation.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identificación del servicio y chequeo de salud con ping a la base de datos.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> home() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "API Lixeira Inteligente v2.0");
        response.put("version", "2.0.0");
        response.put("integrations", List.of("Cloud", "Seguranca", "Big Data", "IoT", "MFA"));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/saude
     * Responde 503 si la base de datos no contesta.
     */
    @GetMapping("/api/saude")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", LocalDateTime.now(ZoneOffset.UTC).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));

        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            response.put("status", "Ok");
            response.put("database", "Conectado");
            return ResponseEntity.ok(response);
        } catch (DataAccessException e) {
            log.error("Chequeo de salud: base de datos no disponible: {}", e.getMessage());
            response.put("status", "Erro");
            response.put("database", "Desconectado");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
    }
}
