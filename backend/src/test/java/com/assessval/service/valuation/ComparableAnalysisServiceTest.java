package com.assessval.service.valuation;

import com.assessval.event.SystemActivityPublisher;
import com.assessval.exception.AnalysisFinalizedException;
import com.assessval.model.comparable.AnalysisEntry;
import com.assessval.model.comparable.ComparableAnalysis;
import com.assessval.model.enums.AnalysisStatus;
import com.assessval.model.enums.ConfidenceLevel;
import com.assessval.model.enums.LineageSource;
import com.assessval.model.enums.Methodology;
import com.assessval.repository.AnalysisEntryRepository;
import com.assessval.repository.ComparableAnalysisRepository;
import com.assessval.repository.ComparableSaleRepository;
import com.assessval.repository.PropertyRepository;
import com.assessval.service.OptimisticUpdateExecutor;
import com.assessval.service.lineage.MutationTracker;
import com.assessval.service.lineage.TrackedUpdate;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ComparableAnalysisService Tests")
class ComparableAnalysisServiceTest {

    private static final Instant NOW = Instant.parse("2024-07-01T09:30:00Z");

    @Mock
    private ComparableAnalysisRepository analysisRepository;

    @Mock
    private AnalysisEntryRepository entryRepository;

    @Mock
    private ComparableSaleRepository saleRepository;

    @Mock
    private PropertyRepository propertyRepository;

    @Mock
    private MutationTracker mutationTracker;

    @Mock
    private OptimisticUpdateExecutor updateExecutor;

    @Mock
    private SystemActivityPublisher activityPublisher;

    private ComparableAnalysisService analysisService;

    @BeforeEach
    void setUp() {
        analysisService = new ComparableAnalysisService(analysisRepository, entryRepository, saleRepository,
            propertyRepository, mutationTracker, updateExecutor, activityPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Create")
    class Create {

        @Test
        @DisplayName("New analyses start as medium-confidence sales-comparison drafts")
        void appliesDefaults() {
            when(propertyRepository.existsByPropertyId("BC001")).thenReturn(true);
            when(analysisRepository.save(any(ComparableAnalysis.class))).thenAnswer(invocation -> invocation.getArgument(0));

            ComparableAnalysis created = analysisService.create(ComparableAnalysis.builder()
                .propertyId("BC001")
                .title("Spring review")
                .status(AnalysisStatus.FINAL)
                .valueConclusion(new BigDecimal("1"))
                .build());

            assertThat(created.getAnalysisId()).startsWith("CA-");
            assertThat(created.getStatus()).isEqualTo(AnalysisStatus.DRAFT);
            assertThat(created.getMethodology()).isEqualTo(Methodology.SALES_COMPARISON);
            assertThat(created.getConfidenceLevel()).isEqualTo(ConfidenceLevel.MEDIUM);
            assertThat(created.getValueConclusion()).isNull();
            assertThat(created.getEffectiveDate()).isEqualTo(LocalDate.of(2024, 7, 1));
        }

        @Test
        @DisplayName("The subject property must exist")
        void requiresSubject() {
            when(propertyRepository.existsByPropertyId("NOPE")).thenReturn(false);

            assertThatThrownBy(() -> analysisService.create(ComparableAnalysis.builder()
                    .propertyId("NOPE").title("x").build()))
                .isInstanceOf(EntityNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Entries")
    class Entries {

        @Test
        @DisplayName("Negative weights are rejected")
        void negativeWeight() {
            assertThatThrownBy(() -> analysisService.addEntry("CA-1", AnalysisEntry.builder()
                    .comparableSaleId(3L).weight(new BigDecimal("-0.5")).build()))
                .isInstanceOf(IllegalArgumentException.class);
            verify(updateExecutor, never()).execute(anyString(), anyString(), any());
            verify(entryRepository, never()).save(any());
        }

        @Test
        @DisplayName("Weights finer than the stored scale are rejected before anything is written")
        void overScaleWeight() {
            assertThatThrownBy(() -> analysisService.addEntry("CA-1", AnalysisEntry.builder()
                    .comparableSaleId(3L).weight(new BigDecimal("0.12345678")).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("decimal place");
            assertThatThrownBy(() -> analysisService.updateEntry(9L, Map.of("adjustedValue", "250000.005"),
                    LineageSource.MANUAL, 1L))
                .isInstanceOf(IllegalArgumentException.class);
            verify(updateExecutor, never()).execute(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("Entries of a final analysis cannot change")
        void finalAnalysisIsFrozen() {
            runWorkDirectly();
            when(analysisRepository.findForChangeByAnalysisId("CA-1")).thenReturn(Optional.of(analysis(AnalysisStatus.FINAL)));

            assertThatThrownBy(() -> analysisService.addEntry("CA-1", AnalysisEntry.builder().comparableSaleId(3L).build()))
                .isInstanceOf(AnalysisFinalizedException.class);
            verify(entryRepository, never()).save(any());
        }

        @Test
        @DisplayName("Adding an entry runs as a retried unit that takes the analysis for change")
        void addEntryTakesAnalysisForChange() {
            runWorkDirectly();
            when(analysisRepository.findForChangeByAnalysisId("CA-1")).thenReturn(Optional.of(analysis(AnalysisStatus.DRAFT)));
            when(saleRepository.existsById(3L)).thenReturn(true);
            when(entryRepository.save(any(AnalysisEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));

            AnalysisEntry added = analysisService.addEntry("CA-1", AnalysisEntry.builder()
                .comparableSaleId(3L).weight(new BigDecimal("2.5")).build());

            assertThat(added.getAnalysisId()).isEqualTo("CA-1");
            assertThat(added.getWeight()).isEqualTo(new BigDecimal("2.500000"));
            assertThat(added.getCreatedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
            verify(updateExecutor).execute(eq("comparableAnalysis"), eq("CA-1"), any());
            verify(analysisRepository, never()).findByAnalysisId(anyString());
        }

        @Test
        @DisplayName("Removing an entry takes the analysis for change and respects finalization")
        void removeEntryTakesAnalysisForChange() {
            runWorkDirectly();
            AnalysisEntry entry = AnalysisEntry.builder().id(9L).analysisId("CA-1").comparableSaleId(3L).build();
            when(entryRepository.findById(9L)).thenReturn(Optional.of(entry));
            when(analysisRepository.findForChangeByAnalysisId("CA-1"))
                .thenReturn(Optional.of(analysis(AnalysisStatus.IN_REVIEW)))
                .thenReturn(Optional.of(analysis(AnalysisStatus.FINAL)));

            analysisService.removeEntry(9L);
            verify(entryRepository).delete(entry);

            assertThatThrownBy(() -> analysisService.removeEntry(9L))
                .isInstanceOf(AnalysisFinalizedException.class);
            verify(entryRepository).delete(any(AnalysisEntry.class));
        }

        @Test
        @DisplayName("Entry updates are tracked under the analysis prefix of the subject property")
        void entryUpdateIsTracked() {
            runWorkDirectly();
            AnalysisEntry entry = AnalysisEntry.builder().id(9L).analysisId("CA-1").comparableSaleId(3L).build();
            when(entryRepository.findById(9L)).thenReturn(Optional.of(entry));
            when(analysisRepository.findForChangeByAnalysisId("CA-1")).thenReturn(Optional.of(analysis(AnalysisStatus.DRAFT)));
            when(entryRepository.saveAndFlush(entry)).thenReturn(entry);

            analysisService.updateEntry(9L, Map.of("weight", "2.5"), LineageSource.MANUAL, 4L);

            ArgumentCaptor<TrackedUpdate> update = ArgumentCaptor.forClass(TrackedUpdate.class);
            verify(mutationTracker).trackUpdate(update.capture(), anyMap(), anyMap());
            assertThat(update.getValue().lineageKey()).isEqualTo("BC001");
            assertThat(update.getValue().qualify("weight")).isEqualTo("analysis.CA-1.entry.9.weight");
            assertThat(entry.getWeight()).isEqualByComparingTo("2.5");
        }
    }

    @Nested
    @DisplayName("Workflow")
    class Workflow {

        @BeforeEach
        void setUp() {
            runWorkDirectly();
        }

        @Test
        @DisplayName("Only drafts can be submitted for review")
        void submitRequiresDraft() {
            when(analysisRepository.findForChangeByAnalysisId("CA-1")).thenReturn(Optional.of(analysis(AnalysisStatus.IN_REVIEW)));

            assertThatThrownBy(() -> analysisService.submitForReview("CA-1", 1L))
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Finalizing needs a value conclusion")
        void finalizeRequiresConclusion() {
            when(analysisRepository.findForChangeByAnalysisId("CA-1")).thenReturn(Optional.of(analysis(AnalysisStatus.IN_REVIEW)));

            assertThatThrownBy(() -> analysisService.finalizeAnalysis("CA-1", 7L, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("value conclusion");
            verify(mutationTracker, never()).trackUpdate(any(), anyMap(), anyMap());
        }

        @Test
        @DisplayName("Finalizing records the reviewer and review time")
        void finalizeRecordsReviewer() {
            ComparableAnalysis analysis = analysis(AnalysisStatus.IN_REVIEW);
            analysis.setValueConclusion(new BigDecimal("285000.00"));
            when(analysisRepository.findForChangeByAnalysisId("CA-1")).thenReturn(Optional.of(analysis));
            when(analysisRepository.saveAndFlush(analysis)).thenReturn(analysis);

            ComparableAnalysis finalized = analysisService.finalizeAnalysis("CA-1", 7L, "Looks right");

            assertThat(finalized.isFinal()).isTrue();
            assertThat(finalized.getReviewedBy()).isEqualTo(7L);
            assertThat(finalized.getReviewNotes()).isEqualTo("Looks right");
            assertThat(finalized.getReviewDate()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
            verify(mutationTracker).trackUpdate(any(TrackedUpdate.class), anyMap(), anyMap());
        }
    }

    @Test
    @DisplayName("Status and conclusion cannot be edited directly")
    void protectedFields() {
        assertThatThrownBy(() -> analysisService.updateAnalysis(
                "CA-1", Map.of("valueConclusion", "1"), LineageSource.MANUAL, 1L))
            .isInstanceOf(IllegalArgumentException.class);
        verify(updateExecutor, never()).execute(anyString(), anyString(), any());
    }

    private void runWorkDirectly() {
        when(updateExecutor.execute(anyString(), anyString(), any()))
            .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(2)).get());
    }

    private static ComparableAnalysis analysis(AnalysisStatus status) {
        return ComparableAnalysis.builder()
            .id(1L)
            .analysisId("CA-1")
            .propertyId("BC001")
            .title("Spring review")
            .methodology(Methodology.SALES_COMPARISON)
            .status(status)
            .build();
    }
}
