package com.smartbin.application.service;

import com.smartbin.application.dto.AuditLogDto;
import com.smartbin.domain.model.AuditLogEntry;
import com.smartbin.domain.model.AuditStatus;
import com.smartbin.domain.port.AuditLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AuditService}.
 */
@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    @Mock
    private AuditLogRepository repository;

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService(repository, Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should append an entry stamped with the current UTC time")
    void shouldAppendEntry() {
        auditService.record("admin", AuditService.EXPORT, "Exportacao CSV", AuditStatus.SUCESSO, true);

        ArgumentCaptor<AuditLogEntry> captor = ArgumentCaptor.forClass(AuditLogEntry.class);
        verify(repository).append(captor.capture());
        AuditLogEntry entry = captor.getValue();
        assertThat(entry.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 3, 15, 12, 0));
        assertThat(entry.getUsername()).isEqualTo("admin");
        assertThat(entry.getAction()).isEqualTo("EXPORT");
        assertThat(entry.getStatus()).isEqualTo(AuditStatus.SUCESSO);
        assertThat(entry.isSensitiveData()).isTrue();
    }

    @Test
    @DisplayName("Should swallow storage failures so the audited action still succeeds")
    void shouldBeBestEffort() {
        doThrow(new IllegalStateException("db down")).when(repository).append(any());

        assertThatCode(() -> auditService.failure("admin", AuditService.LOGIN, "Senha incorreta"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should cap the query limit and ignore a blank username filter")
    void shouldCapQuery() {
        AuditLogEntry entry = AuditLogEntry.builder()
                .timestamp(LocalDateTime.of(2024, 3, 15, 11, 0))
                .username("ana")
                .action("LOGIN")
                .status(AuditStatus.ERRO)
                .build();
        when(repository.findRecent(null, AuditService.MAX_QUERY_LIMIT)).thenReturn(List.of(entry));

        List<AuditLogDto> logs = auditService.findRecent(" ", 50_000);

        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).getStatus()).isEqualTo("erro");
        assertThat(logs.get(0).getTimestamp()).isEqualTo("2024-03-15T11:00:00");
    }
}
