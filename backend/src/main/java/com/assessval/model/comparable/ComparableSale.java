package com.assessval.model.comparable;

import com.assessval.model.AuditableEntity;
import com.assessval.model.enums.ComparableSaleStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A comparable chosen by an analyst for a subject property.
 * Sale fields are empty when the comparable is not an actual sale.
 */
@Entity
@Table(name = "comparable_sales", indexes = {
    @Index(name = "idx_comp_sale_subject", columnList = "property_id"),
    @Index(name = "idx_comp_sale_status", columnList = "status")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class ComparableSale extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Subject property identifier.
     */
    @Column(name = "property_id", nullable = false, length = 100)
    private String propertyId;

    @Column(name = "comparable_property_id", nullable = false, length = 100)
    private String comparablePropertyId;

    @Column(name = "sale_date")
    private LocalDate saleDate;

    @Column(name = "sale_price", precision = 19, scale = 2)
    private BigDecimal salePrice;

    @Column(name = "adjusted_price", precision = 19, scale = 2)
    private BigDecimal adjustedPrice;

    @Column(name = "distance_in_miles", precision = 10, scale = 3)
    private BigDecimal distanceInMiles;

    @Column(name = "similarity_score", precision = 10, scale = 4)
    private BigDecimal similarityScore;

    /**
     * JSON object of named adjustments (size, quality, location...).
     */
    @Column(name = "adjustment_factors", columnDefinition = "TEXT")
    private String adjustmentFactors;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private ComparableSaleStatus status;

    @Column(name = "created_by")
    private Long createdBy;

    @Version
    private Long version;
}
