package com.assessval.model.property;

import com.assessval.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

/**
 * Structure on a property. Related to its property by business key only.
 */
@Entity
@Table(name = "improvements", indexes = {
    @Index(name = "idx_improvement_property", columnList = "property_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Improvement extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false, length = 100)
    private String propertyId;

    @Column(name = "improvement_type", length = 100)
    private String improvementType;

    @Column(name = "year_built")
    private Integer yearBuilt;

    @Column(name = "square_feet", precision = 19, scale = 2)
    private BigDecimal squareFeet;

    private Integer bedrooms;

    @Column(precision = 6, scale = 2)
    private BigDecimal bathrooms;

    @Column(length = 50)
    private String quality;

    @Column(name = "condition_rating", length = 50)
    private String condition;
}
