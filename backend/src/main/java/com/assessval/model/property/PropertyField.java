package com.assessval.model.property;

import com.assessval.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Single typed attribute captured for a property (e.g. squareFeet, zoning).
 * Changes are recorded in the owning property's lineage as
 * {@code field.<fieldType>.<attribute>}.
 */
@Entity
@Table(name = "fields", indexes = {
    @Index(name = "idx_field_property", columnList = "property_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyField extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false, length = 100)
    private String propertyId;

    @Column(name = "field_type", nullable = false, length = 100)
    private String fieldType;

    @Column(name = "field_value", columnDefinition = "TEXT")
    private String fieldValue;

    @Version
    private Long version;
}
