package com.assessval.model.lineage;

import com.assessval.model.enums.LineageSource;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * One field-level change. Records are written once and never updated or
 * deleted; a correction is a new record with source {@code correction}.
 */
@Entity
@Immutable
@Table(name = "data_lineage_records", indexes = {
    @Index(name = "idx_lineage_entity", columnList = "entity_id"),
    @Index(name = "idx_lineage_entity_field", columnList = "entity_id, field_name"),
    @Index(name = "idx_lineage_user", columnList = "user_id"),
    @Index(name = "idx_lineage_source", columnList = "source"),
    @Index(name = "idx_lineage_timestamp", columnList = "change_timestamp")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LineageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Business identifier of the entity whose history this record belongs to.
     */
    @Column(name = "entity_id", nullable = false, length = 100, updatable = false)
    private String entityId;

    @Column(name = "field_name", nullable = false, length = 255, updatable = false)
    private String fieldName;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "old_value_kind", length = 10, nullable = false, updatable = false)),
        @AttributeOverride(name = "text", column = @Column(name = "old_value", columnDefinition = "TEXT", nullable = false, updatable = false))
    })
    private LineageValue oldValue;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "new_value_kind", length = 10, nullable = false, updatable = false)),
        @AttributeOverride(name = "text", column = @Column(name = "new_value", columnDefinition = "TEXT", nullable = false, updatable = false))
    })
    private LineageValue newValue;

    @Column(name = "change_timestamp", nullable = false, updatable = false)
    private LocalDateTime changeTimestamp;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private LineageSource source;

    @Column(name = "user_id", updatable = false)
    private Long userId;

    /**
     * JSON object describing the operation that produced the change.
     */
    @Column(name = "source_details", columnDefinition = "TEXT", updatable = false)
    private String sourceDetails;

    /**
     * Shared by every record written for one update call.
     */
    @Column(name = "batch_id", nullable = false, length = 36, updatable = false)
    private String batchId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
