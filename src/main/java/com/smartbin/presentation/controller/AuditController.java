package com.smartbin.presentation.controller;

import com.smartbin.application.dto.AuditLogDto;
import com.smartbin.application.service.AuditService;
import com.smartbin.application.service.AuthorizationService;
import com.smartbin.domain.model.Role;
import com.smartbin.presentation.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Consulta del registro de auditoría (solo admin).
 */
@RestController
@RequestMapping("/api/auditoria")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;
    private final AuthorizationService authorizationService;

    @GetMapping("/logs")
    public ResponseEntity<Map<String, Object>> logs(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username,
            @RequestParam(name = "usuario", required = false) String filter,
            @RequestParam(name = "limite", defaultValue = "100") int limit) {
        authorizationService.requireAnyRole(username, Role.ADMIN);

        List<AuditLogDto> logs = auditService.findRecent(filter, limit);
        Map<String, Object> response = ApiResponses.body(true);
        response.put("total", logs.size());
        response.put("logs", logs);
        return ResponseEntity.ok(response);
    }
}
