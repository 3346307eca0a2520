package com.assessval.model.comparable;

import com.assessval.model.AuditableEntity;
import com.assessval.model.enums.AnalysisStatus;
import com.assessval.model.enums.ConfidenceLevel;
import com.assessval.model.enums.Methodology;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Reconciliation session for one subject property.
 */
@Entity
@Table(name = "comparable_sales_analyses", indexes = {
    @Index(name = "idx_analysis_subject", columnList = "property_id"),
    @Index(name = "idx_analysis_status", columnList = "status")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class ComparableAnalysis extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "analysis_id", nullable = false, unique = true, length = 100)
    private String analysisId;

    @Column(name = "property_id", nullable = false, length = 100)
    private String propertyId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private Methodology methodology;

    @Column(name = "effective_date")
    private LocalDate effectiveDate;

    @Column(name = "value_conclusion", precision = 19, scale = 2)
    private BigDecimal valueConclusion;

    @Column(name = "adjustment_notes", columnDefinition = "TEXT")
    private String adjustmentNotes;

    @Column(name = "market_conditions", columnDefinition = "TEXT")
    private String marketConditions;

    @Enumerated(EnumType.STRING)
    @Column(name = "confidence_level", length = 50)
    private ConfidenceLevel confidenceLevel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private AnalysisStatus status;

    /**
     * When set, a successful reconciliation also writes the conclusion to the
     * subject property's current value.
     */
    @Column(name = "update_property_value", nullable = false)
    private boolean updatePropertyValue;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "reviewed_by")
    private Long reviewedBy;

    @Column(name = "review_notes", columnDefinition = "TEXT")
    private String reviewNotes;

    @Column(name = "review_date")
    private LocalDateTime reviewDate;

    @Version
    private Long version;

    public boolean isFinal() {
        return status == AnalysisStatus.FINAL;
    }
}
