package com.assessval.model.property;

import com.assessval.model.AuditableEntity;
import com.assessval.model.enums.PropertyType;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

/**
 * Assessed property. {@code propertyId} is the stable business key; {@code id}
 * is the storage key and never leaves the persistence layer in lineage records.
 */
@Entity
@Table(name = "properties", indexes = {
    @Index(name = "idx_property_type", columnList = "property_type"),
    @Index(name = "idx_property_status", columnList = "status")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Property extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false, unique = true, length = 100)
    private String propertyId;

    @Column(length = 500)
    private String address;

    @Column(name = "parcel_number", length = 100)
    private String parcelNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "property_type", nullable = false, length = 50)
    private PropertyType propertyType;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal acres;

    @Column(name = "current_value", precision = 19, scale = 2)
    private BigDecimal currentValue;

    @Column(nullable = false, length = 50)
    private String status;

    /**
     * JSON object of county-specific extension attributes.
     */
    @Column(name = "extra_fields", columnDefinition = "TEXT")
    private String extraFields;

    @Version
    private Long version;
}
