package com.assessval.service.valuation;

import com.assessval.event.SystemActivityPublisher;
import com.assessval.exception.AnalysisFinalizedException;
import com.assessval.exception.NoParticipatingEntriesException;
import com.assessval.model.comparable.AnalysisEntry;
import com.assessval.model.comparable.ComparableAnalysis;
import com.assessval.model.comparable.ComparableSale;
import com.assessval.model.enums.AnalysisStatus;
import com.assessval.model.enums.ComparableSaleStatus;
import com.assessval.model.enums.LineageSource;
import com.assessval.model.property.Property;
import com.assessval.repository.AnalysisEntryRepository;
import com.assessval.repository.ComparableSaleRepository;
import com.assessval.service.OptimisticUpdateExecutor;
import com.assessval.service.PropertyService;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReconciliationService Tests")
class ReconciliationServiceTest {

    @Mock
    private ComparableAnalysisService analysisService;

    @Mock
    private AnalysisEntryRepository entryRepository;

    @Mock
    private ComparableSaleRepository saleRepository;

    @Mock
    private PropertyService propertyService;

    @Mock
    private OptimisticUpdateExecutor updateExecutor;

    @Mock
    private SystemActivityPublisher activityPublisher;

    @InjectMocks
    private ReconciliationService reconciliationService;

    @Captor
    private ArgumentCaptor<Map<String, Object>> patchCaptor;

    private final List<AnalysisEntry> entries = new ArrayList<>();
    private final Map<Long, ComparableSale> sales = new HashMap<>();
    private long nextId = 1;

    @BeforeEach
    void setUp() {
        entries.clear();
        sales.clear();
    }

    @Nested
    @DisplayName("Weighted calculation")
    class Calculation {

        @Test
        @DisplayName("Weights 1 and 3 over 300000 and 280000 give 285000")
        void weightedAverage() {
            entry(sale(null, "300000"), "1", null, true);
            entry(sale(null, "280000"), "3", null, true);

            ReconciliationService.Tally tally = reconciliationService.calculate(entries, sales);

            assertThat(tally.conclusion()).isEqualByComparingTo("285000");
            assertThat(tally.conclusion().scale()).isEqualTo(2);
            assertThat(tally.participating()).isEqualTo(2);
            assertThat(tally.totalWeight()).isEqualByComparingTo("4");
            assertThat(tally.warnings()).isEmpty();
        }

        @Test
        @DisplayName("A single entry reconciles to its own value whatever its weight")
        void singleEntryIsIdentity() {
            entry(sale(null, "412345.67"), "0.35", null, true);

            assertThat(reconciliationService.calculate(entries, sales).conclusion())
                .isEqualByComparingTo("412345.67");
        }

        @Test
        @DisplayName("Excluded entries never change the conclusion")
        void exclusionLaw() {
            entry(sale(null, "300000"), "1", null, true);
            entry(sale(null, "280000"), "3", null, true);
            BigDecimal without = reconciliationService.calculate(entries, sales).conclusion();

            entry(sale(null, "999999"), "10", null, false);
            BigDecimal with = reconciliationService.calculate(entries, sales).conclusion();

            assertThat(with).isEqualByComparingTo(without);
        }

        @Test
        @DisplayName("Entry override beats the sale's adjusted price, which beats the sale price")
        void effectiveValuePrecedence() {
            ComparableSale adjusted = sale("310000", "300000");
            ComparableSale raw = sale(null, "300000");

            assertThat(ReconciliationService.effectiveValue(entryFor(adjusted, new BigDecimal("320000")), adjusted))
                .isEqualByComparingTo("320000");
            assertThat(ReconciliationService.effectiveValue(entryFor(adjusted, null), adjusted))
                .isEqualByComparingTo("310000");
            assertThat(ReconciliationService.effectiveValue(entryFor(raw, null), raw))
                .isEqualByComparingTo("300000");
        }

        @Test
        @DisplayName("Entries without any value are left out with a warning")
        void unresolvableValueWarns() {
            entry(sale(null, "300000"), "1", null, true);
            entry(sale(null, null), "5", null, true);

            ReconciliationService.Tally tally = reconciliationService.calculate(entries, sales);

            assertThat(tally.conclusion()).isEqualByComparingTo("300000");
            assertThat(tally.participating()).isEqualTo(1);
            assertThat(tally.warnings()).hasSize(1);
            assertThat(tally.warnings().get(0)).contains("excluded");
        }

        @Test
        @DisplayName("Withdrawn sales still count but are flagged")
        void withdrawnSaleWarns() {
            ComparableSale withdrawn = sale(null, "300000");
            withdrawn.setStatus(ComparableSaleStatus.WITHDRAWN);
            entry(withdrawn, "1", null, true);

            ReconciliationService.Tally tally = reconciliationService.calculate(entries, sales);

            assertThat(tally.participating()).isEqualTo(1);
            assertThat(tally.warnings()).hasSize(1);
            assertThat(tally.warnings().get(0)).contains("withdrawn");
        }

        @Test
        @DisplayName("An included entry whose sale is missing fails the calculation")
        void missingSale() {
            entries.add(AnalysisEntry.builder().id(99L).analysisId("CA-1").comparableSaleId(404L).build());

            assertThatThrownBy(() -> reconciliationService.calculate(entries, sales))
                .isInstanceOf(EntityNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Reconcile")
    class Reconcile {

        @BeforeEach
        void runWorkDirectly() {
            when(updateExecutor.execute(anyString(), anyString(), any()))
                .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(2)).get());
        }

        @Test
        @DisplayName("Writes the conclusion to the analysis and the subject property")
        void writesConclusion() {
            ComparableAnalysis analysis = analysis(AnalysisStatus.DRAFT, true);
            Property subject = Property.builder().propertyId("BC001").build();
            entry(sale(null, "300000"), "1", null, true);
            entry(sale(null, "280000"), "3", null, true);
            stubEntries(analysis);
            when(propertyService.getByPropertyId("BC001")).thenReturn(subject);

            ReconciliationResult result = reconciliationService.reconcile("CA-1", 5L);

            assertThat(result.valueConclusion()).isEqualByComparingTo("285000");
            assertThat(result.propertyUpdated()).isTrue();

            verify(analysisService).applyPatch(eq(analysis), patchCaptor.capture(),
                eq(LineageSource.CALCULATED), eq(5L), eq("reconcileAnalysis"));
            assertThat((BigDecimal) patchCaptor.getValue().get("valueConclusion")).isEqualByComparingTo("285000");

            verify(propertyService).applyPatch(eq(subject), patchCaptor.capture(),
                eq(LineageSource.CALCULATED), eq(5L), eq("reconcileAnalysis"));
            assertThat((BigDecimal) patchCaptor.getValue().get("currentValue")).isEqualByComparingTo("285000");
        }

        @Test
        @DisplayName("Leaves the property alone unless the analysis asks for it")
        void analysisOnly() {
            ComparableAnalysis analysis = analysis(AnalysisStatus.IN_REVIEW, false);
            entry(sale(null, "250000"), "1", null, true);
            stubEntries(analysis);

            ReconciliationResult result = reconciliationService.reconcile("CA-1", null);

            assertThat(result.propertyUpdated()).isFalse();
            verify(propertyService, never()).applyPatch(any(), anyMap(), any(), any(), anyString());
        }

        @Test
        @DisplayName("No usable entries fails and writes nothing")
        void noParticipatingEntries() {
            ComparableAnalysis analysis = analysis(AnalysisStatus.DRAFT, true);
            entry(sale(null, "300000"), "1", null, false);
            entry(sale(null, null), "1", null, true);
            when(analysisService.getAnalysisForChange("CA-1")).thenReturn(analysis);
            when(entryRepository.findByAnalysisIdOrderByIdAsc("CA-1")).thenReturn(entries);
            when(saleRepository.findByIdIn(anyCollection())).thenReturn(new ArrayList<>(sales.values()));

            NoParticipatingEntriesException ex = catchThrowableOfType(
                () -> reconciliationService.reconcile("CA-1", 1L), NoParticipatingEntriesException.class);

            assertThat(ex).isNotNull();
            assertThat(ex.getWarnings()).hasSize(1);

            verify(analysisService, never()).applyPatch(any(), anyMap(), any(), any(), anyString());
            verify(propertyService, never()).applyPatch(any(), anyMap(), any(), any(), anyString());
        }

        @Test
        @DisplayName("A final analysis cannot be reconciled again")
        void finalAnalysisRejected() {
            when(analysisService.getAnalysisForChange("CA-1")).thenReturn(analysis(AnalysisStatus.FINAL, true));

            assertThatThrownBy(() -> reconciliationService.reconcile("CA-1", 1L))
                .isInstanceOf(AnalysisFinalizedException.class);
            verify(entryRepository, never()).findByAnalysisIdOrderByIdAsc(anyString());
        }

        private void stubEntries(ComparableAnalysis analysis) {
            when(analysisService.getAnalysisForChange("CA-1")).thenReturn(analysis);
            when(entryRepository.findByAnalysisIdOrderByIdAsc("CA-1")).thenReturn(entries);
            when(saleRepository.findByIdIn(anyCollection())).thenReturn(new ArrayList<>(sales.values()));
        }
    }

    // ========================================================================
    // Fixtures
    // ========================================================================

    private ComparableAnalysis analysis(AnalysisStatus status, boolean updatePropertyValue) {
        return ComparableAnalysis.builder()
            .id(1L)
            .analysisId("CA-1")
            .propertyId("BC001")
            .title("Spring review")
            .status(status)
            .updatePropertyValue(updatePropertyValue)
            .build();
    }

    private ComparableSale sale(String adjustedPrice, String salePrice) {
        ComparableSale sale = ComparableSale.builder()
            .id(nextId++)
            .propertyId("BC001")
            .comparablePropertyId("BC0" + nextId)
            .adjustedPrice(adjustedPrice != null ? new BigDecimal(adjustedPrice) : null)
            .salePrice(salePrice != null ? new BigDecimal(salePrice) : null)
            .status(ComparableSaleStatus.ACTIVE)
            .build();
        sales.put(sale.getId(), sale);
        return sale;
    }

    private void entry(ComparableSale sale, String weight, String adjustedValue, boolean included) {
        entries.add(AnalysisEntry.builder()
            .id(nextId++)
            .analysisId("CA-1")
            .comparableSaleId(sale.getId())
            .weight(new BigDecimal(weight))
            .adjustedValue(adjustedValue != null ? new BigDecimal(adjustedValue) : null)
            .includeInFinalValue(included)
            .build());
    }

    private static AnalysisEntry entryFor(ComparableSale sale, BigDecimal adjustedValue) {
        return AnalysisEntry.builder().comparableSaleId(sale.getId()).adjustedValue(adjustedValue).build();
    }
}
