package com.smartbin.presentation.controller;

import com.smartbin.application.dto.ExecutiveReportDto;
import com.smartbin.application.service.AuditService;
import com.smartbin.application.service.AuthorizationService;
import com.smartbin.application.service.ReportService;
import com.smartbin.domain.model.Permission;
import com.smartbin.presentation.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Reportes: ejecutivo en JSON y exportación CSV. Requieren el permiso EXPORT.
 */
@RestController
@RequestMapping("/api/relatorios")
@RequiredArgsConstructor
@Slf4j
public class ReportController {

    static final String CSV_FILENAME = "leituras.csv";

    private final ReportService reportService;
    private final AuthorizationService authorizationService;
    private final AuditService auditService;

    @GetMapping("/executivo")
    public ResponseEntity<Map<String, Object>> executiveReport(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username) {
        authorizationService.requirePermission(username, Permission.EXPORT);

        ExecutiveReportDto report = reportService.generateExecutiveReport();
        auditService.success(username, AuditService.EXPORT, "Relatorio executivo gerado");
        return ApiResponses.ok("report", report);
    }

    @GetMapping("/csv")
    public ResponseEntity<String> exportCsv(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username) {
        authorizationService.requirePermission(username, Permission.EXPORT);

        String csv = reportService.exportCsv();
        auditService.success(username, AuditService.EXPORT, "Exportacao CSV");
        log.info("CSV exportado por {}", username);

        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + CSV_FILENAME)
                .body(csv);
    }
}
