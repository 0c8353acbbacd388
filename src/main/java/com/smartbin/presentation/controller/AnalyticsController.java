package com.smartbin.presentation.controller;

import com.smartbin.application.service.AnalyticsService;
import com.smartbin.application.service.AuditService;
import com.smartbin.application.service.AuthorizationService;
import com.smartbin.domain.analytics.StatsEngine;
import com.smartbin.domain.model.Permission;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.presentation.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Endpoints de analítica. Todos requieren el permiso ANALYZE.
 */
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;
    private final AuthorizationService authorizationService;
    private final AuditService auditService;

    @GetMapping("/padroes")
    public ResponseEntity<Map<String, Object>> patterns(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username,
            @RequestParam(name = "dias", defaultValue = "30") int days) {
        authorizationService.requirePermission(username, Permission.ANALYZE);
        auditService.success(username, AuditService.ANALYZE, "Analise de padroes (" + days + " dias)");
        return respond("patterns", analyticsService.analyzePatterns(days));
    }

    @GetMapping("/predicoes")
    public ResponseEntity<Map<String, Object>> forecast(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username,
            @RequestParam(name = "dias", defaultValue = "7") int futureDays) {
        authorizationService.requirePermission(username, Permission.ANALYZE);
        auditService.success(username, AuditService.ANALYZE, "Predicao de " + futureDays + " dias");
        return respond("forecast", analyticsService.forecast(futureDays));
    }

    @GetMapping("/anomalias")
    public ResponseEntity<Map<String, Object>> anomalies(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username,
            @RequestParam(name = "sensibilidade", defaultValue = "" + StatsEngine.DEFAULT_SENSITIVITY)
            double sensitivity) {
        authorizationService.requirePermission(username, Permission.ANALYZE);
        auditService.success(username, AuditService.ANALYZE, "Deteccao de anomalias (k=" + sensitivity + ")");
        return respond("anomalies", analyticsService.detectAnomalies(sensitivity));
    }

    @GetMapping("/comparacao")
    public ResponseEntity<Map<String, Object>> comparison(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username,
            @RequestParam(name = "periodo1", defaultValue = "7") int currentDays,
            @RequestParam(name = "periodo2", defaultValue = "7") int previousDays) {
        authorizationService.requirePermission(username, Permission.ANALYZE);
        auditService.success(username, AuditService.ANALYZE,
                "Comparacao " + currentDays + " vs " + previousDays + " dias");
        return respond("comparison", analyticsService.comparePeriods(currentDays, previousDays));
    }

    private static ResponseEntity<Map<String, Object>> respond(String key, ServiceResult<?> result) {
        if (!result.isSuccess()) {
            return ApiResponses.failure(result.getError(), result.getMessage());
        }
        return ApiResponses.ok(key, result.getValue());
    }
}
