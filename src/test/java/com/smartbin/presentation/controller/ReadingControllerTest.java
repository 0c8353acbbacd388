package com.smartbin.presentation.controller;

import com.smartbin.application.dto.IngestReadingRequest;
import com.smartbin.application.dto.ReadingDto;
import com.smartbin.application.service.AuditService;
import com.smartbin.application.service.AuthorizationService;
import com.smartbin.application.service.ReadingService;
import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.exception.ServiceException;
import com.smartbin.domain.model.Permission;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.domain.port.SessionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP boundary tests for {@link ReadingController}, including the token
 * interceptor and the exception handler.
 */
@WebMvcTest(controllers = ReadingController.class)
class ReadingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReadingService readingService;

    @MockBean
    private AuthorizationService authorizationService;

    @MockBean
    private AuditService auditService;

    @MockBean
    private SessionStore sessionStore;

    @Test
    @DisplayName("Should accept a device reading without a token")
    void shouldIngestWithoutToken() throws Exception {
        ReadingDto dto = ReadingDto.builder().id(1L).weightKg(3.5).sensorId("esp32-lixeira-001").build();
        when(readingService.ingest(any(IngestReadingRequest.class))).thenReturn(ServiceResult.success(dto));

        mockMvc.perform(post("/api/dados")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"peso_kg\": 3.5, \"sensor_id\": \"esp32-lixeira-001\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.reading.peso_kg").value(3.5))
                .andExpect(jsonPath("$.reading.sensor_id").value("esp32-lixeira-001"));

        verifyNoInteractions(sessionStore);
    }

    @Test
    @DisplayName("Should answer 400 when the reading is rejected")
    void shouldRejectInvalidReading() throws Exception {
        when(readingService.ingest(any(IngestReadingRequest.class)))
                .thenReturn(ServiceResult.failure(ErrorKind.VALIDATION, "Campos obrigatórios: peso_kg, sensor_id"));

        mockMvc.perform(post("/api/dados")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sensor_id\": \"s1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("VALIDATION"));
    }

    @Test
    @DisplayName("Should answer 400 for a body that is not JSON")
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/dados")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION"));

        verifyNoInteractions(readingService);
    }

    @Test
    @DisplayName("Should answer 401 when a protected route has no token")
    void shouldRequireToken() throws Exception {
        mockMvc.perform(get("/api/leituras"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

        verifyNoInteractions(readingService);
    }

    @Test
    @DisplayName("Should answer 401 for an unknown token")
    void shouldRejectUnknownToken() throws Exception {
        when(sessionStore.get("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/leituras").header("Authorization", "Bearer ghost"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Should list the latest readings for an authorised user and audit the query")
    void shouldListLatestReadings() throws Exception {
        when(sessionStore.get("tok")).thenReturn(Optional.of("ana"));
        when(readingService.getLatest(5, "s1")).thenReturn(List.of(
                ReadingDto.builder().id(2L).weightKg(2.0).sensorId("s1").build()));

        mockMvc.perform(get("/api/leituras")
                        .header("Authorization", "Bearer tok")
                        .param("limite", "5")
                        .param("sensor_id", "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.readings[0].sensor_id").value("s1"));

        verify(authorizationService).requirePermission("ana", Permission.READ);
        verify(auditService).success(eq("ana"), eq(AuditService.READ), anyString());
    }

    @Test
    @DisplayName("Should answer 403 when the role lacks the permission")
    void shouldForbidWithoutPermission() throws Exception {
        when(sessionStore.get("tok")).thenReturn(Optional.of("ana"));
        when(authorizationService.requirePermission("ana", Permission.READ))
                .thenThrow(ServiceException.forbidden("Permissão negada"));

        mockMvc.perform(get("/api/sensores").header("Authorization", "Bearer tok"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));

        verifyNoInteractions(readingService);
    }
}
