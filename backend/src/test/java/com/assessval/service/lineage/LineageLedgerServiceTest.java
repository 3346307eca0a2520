package com.assessval.service.lineage;

import com.assessval.config.ValuationProperties;
import com.assessval.event.SystemActivityPublisher;
import com.assessval.model.enums.LineageSource;
import com.assessval.model.lineage.LineageRecord;
import com.assessval.model.lineage.LineageValue;
import com.assessval.repository.LineageRecordRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LineageLedgerService Tests")
class LineageLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T08:00:00Z");

    @Mock
    private LineageRecordRepository repository;

    @Mock
    private SystemActivityPublisher activityPublisher;

    private LineageLedgerService ledger;

    @BeforeEach
    void setUp() {
        ValuationProperties properties = new ValuationProperties();
        properties.getLineage().setDefaultLimit(100);
        properties.getLineage().setMaxLimit(1000);
        ledger = new LineageLedgerService(repository, new LineageValueCodec(new ObjectMapper()),
            activityPublisher, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Limits")
    class Limits {

        @Test
        @DisplayName("Missing limit uses the default page size")
        void defaultLimit() {
            ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
            when(repository.findByUserIdOrderByChangeTimestampDescIdDesc(eq(7L), page.capture())).thenReturn(List.of());

            ledger.byUser(7L, null);

            assertThat(page.getValue().getPageSize()).isEqualTo(100);
            assertThat(page.getValue().getPageNumber()).isZero();
        }

        @Test
        @DisplayName("Oversized limits are capped")
        void cappedLimit() {
            ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
            when(repository.findBySourceOrderByChangeTimestampDescIdDesc(eq(LineageSource.IMPORT), page.capture()))
                .thenReturn(List.of());

            ledger.bySource(LineageSource.IMPORT, 50_000);

            assertThat(page.getValue().getPageSize()).isEqualTo(1000);
        }

        @Test
        @DisplayName("Zero or negative limits are rejected")
        void nonPositiveLimit() {
            assertThatThrownBy(() -> ledger.bySource(LineageSource.MANUAL, 0))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Date range must be complete and ordered")
        void dateRangeValidation() {
            LocalDateTime start = LocalDateTime.of(2024, 1, 1, 0, 0);
            LocalDateTime end = LocalDateTime.of(2024, 2, 1, 0, 0);

            assertThatThrownBy(() -> ledger.byDateRange(end, start, 10)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ledger.byDateRange(null, end, 10)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Corrections")
    class Corrections {

        @Test
        @DisplayName("A correction chains from the latest recorded value")
        void chainsFromLatestValue() {
            LineageRecord latest = record("currentValue", LineageValue.ofJson("250000"), LineageValue.ofJson("275000"));
            when(repository.findByEntityIdAndFieldNameOrderByChangeTimestampDescIdDesc("BC001", "currentValue"))
                .thenReturn(List.of(latest));
            when(repository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

            LineageRecord correction = ledger.recordCorrection(
                "BC001", "currentValue", new BigDecimal("265000"), 9L, "Keying error");

            assertThat(correction.getSource()).isEqualTo(LineageSource.CORRECTION);
            assertThat(correction.getOldValue()).isEqualTo(LineageValue.ofJson("275000"));
            assertThat(correction.getNewValue()).isEqualTo(LineageValue.ofJson("265000"));
            assertThat(correction.getChangeTimestamp()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
            assertThat(correction.getSourceDetails()).contains("Keying error");
            verify(activityPublisher).record(anyString(), eq("lineage"), eq("BC001"));
        }

        @Test
        @DisplayName("A correction of a field without history starts from null")
        void noHistory() {
            when(repository.findByEntityIdAndFieldNameOrderByChangeTimestampDescIdDesc("BC001", "status"))
                .thenReturn(List.of());
            when(repository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

            LineageRecord correction = ledger.recordCorrection("BC001", "status", "exempt", null, "Data fix");

            assertThat(correction.getOldValue().isNull()).isTrue();
            assertThat(correction.getNewValue()).isEqualTo(LineageValue.ofString("exempt"));
        }

        @Test
        @DisplayName("Entity and field are required")
        void requiresTarget() {
            assertThatThrownBy(() -> ledger.recordCorrection("", "status", "x", null, "r"))
                .isInstanceOf(IllegalArgumentException.class);
            verify(repository, never()).saveAll(any());
        }
    }

    @Test
    @DisplayName("Grouping keeps the newest-first order within and across fields")
    void groupsByField() {
        LineageRecord newestStatus = record("status", LineageValue.ofString("active"), LineageValue.ofString("exempt"));
        LineageRecord value = record("currentValue", LineageValue.nullValue(), LineageValue.ofJson("1"));
        LineageRecord olderStatus = record("status", LineageValue.ofString("new"), LineageValue.ofString("active"));
        when(repository.findByEntityIdOrderByChangeTimestampDescIdDesc("BC001"))
            .thenReturn(List.of(newestStatus, value, olderStatus));

        Map<String, List<LineageRecord>> grouped = ledger.groupedByField("BC001");

        assertThat(grouped.keySet()).containsExactly("status", "currentValue");
        assertThat(grouped.get("status")).containsExactly(newestStatus, olderStatus);
    }

    private static LineageRecord record(String field, LineageValue oldValue, LineageValue newValue) {
        return LineageRecord.builder()
            .entityId("BC001")
            .fieldName(field)
            .oldValue(oldValue)
            .newValue(newValue)
            .changeTimestamp(LocalDateTime.of(2024, 1, 1, 12, 0))
            .source(LineageSource.MANUAL)
            .sourceDetails("{}")
            .batchId("b-1")
            .createdAt(LocalDateTime.of(2024, 1, 1, 12, 0))
            .build();
    }
}
