package com.assessval.model.comparable;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Links an analysis to one comparable sale with the analyst's weighting.
 */
@Entity
@Table(name = "comparable_analysis_entries", indexes = {
    @Index(name = "idx_entry_analysis", columnList = "analysis_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "analysis_id", nullable = false, length = 100)
    private String analysisId;

    @Column(name = "comparable_sale_id", nullable = false)
    private Long comparableSaleId;

    @Builder.Default
    @Column(name = "include_in_final_value", nullable = false)
    private boolean includeInFinalValue = true;

    @Builder.Default
    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal weight = BigDecimal.ONE;

    /**
     * Analyst override; takes precedence over the sale's adjusted and raw price.
     */
    @Column(name = "adjusted_value", precision = 19, scale = 2)
    private BigDecimal adjustedValue;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;
}
