package com.smartbin.application.service;

import com.smartbin.domain.analytics.PeriodComparison;
import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.model.Reading;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.domain.port.ReadingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AnalyticsServiceImpl}.
 */
@ExtendWith(MockitoExtension.class)
class AnalyticsServiceImplTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 15, 12, 0);

    @Mock
    private ReadingRepository readingRepository;

    private AnalyticsServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new AnalyticsServiceImpl(readingRepository,
                Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should train the forecast on the last 90 days")
    void shouldUseNinetyDayTrainingWindow() {
        when(readingRepository.findSince(NOW.minusDays(90))).thenReturn(List.of());

        assertThat(service.forecast(7).getError()).isEqualTo(ErrorKind.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("Should look for anomalies in the last 30 days")
    void shouldUseThirtyDayAnomalyWindow() {
        when(readingRepository.findSince(NOW.minusDays(30))).thenReturn(List.of(
                reading(NOW.minusDays(2), 1), reading(NOW.minusDays(1), 1), reading(NOW, 50)));

        assertThat(service.detectAnomalies(1.0).getValue()).hasSize(1);
    }

    @Test
    @DisplayName("Should fetch both comparison periods in a single window")
    void shouldFetchBothPeriods() {
        when(readingRepository.findSince(NOW.minusDays(14))).thenReturn(List.of(
                reading(NOW.minusDays(10), 10), reading(NOW.minusDays(1), 5)));

        ServiceResult<PeriodComparison> result = service.comparePeriods(7, 7);

        assertThat(result.getValue().getPrevious().getTotalKg()).isEqualTo(10.0);
        assertThat(result.getValue().getTotalChangePercent()).isEqualTo(-50.0);
        verify(readingRepository).findSince(NOW.minusDays(14));
    }

    @Test
    @DisplayName("Should reject invalid parameters before touching storage")
    void shouldValidateParameters() {
        assertThat(service.detectAnomalies(-1).getError()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(service.comparePeriods(0, 7).getError()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(service.analyzePatterns(0).getError()).isEqualTo(ErrorKind.VALIDATION);
        verifyNoInteractions(readingRepository);
    }

    private static Reading reading(LocalDateTime timestamp, double weight) {
        return Reading.builder().timestamp(timestamp).weightKg(weight).sensorId("s1").build();
    }
}
