package com.assessval.model.property;

import com.assessval.model.AuditableEntity;
import com.assessval.model.enums.AppealStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Owner appeal against an assessed value.
 */
@Entity
@Table(name = "appeals", indexes = {
    @Index(name = "idx_appeal_property", columnList = "property_id"),
    @Index(name = "idx_appeal_status", columnList = "status")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Appeal extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "appeal_number", nullable = false, unique = true, length = 100)
    private String appealNumber;

    @Column(name = "property_id", nullable = false, length = 100)
    private String propertyId;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "appeal_type", nullable = false, length = 50)
    private String appealType;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "requested_value", precision = 19, scale = 2)
    private BigDecimal requestedValue;

    @Column(name = "hearing_date")
    private LocalDateTime hearingDate;

    @Column(name = "hearing_location", length = 255)
    private String hearingLocation;

    @Column(name = "assigned_to")
    private Long assignedTo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private AppealStatus status;

    @Column(length = 50)
    private String decision;

    @Column(name = "decision_reason", columnDefinition = "TEXT")
    private String decisionReason;

    @Version
    private Long version;
}
