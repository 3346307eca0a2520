package com.assessval.event;

import java.time.LocalDateTime;

/**
 * Activity notice for the system activity log. Published after the fact;
 * the outcome of the operation that emitted it never depends on delivery.
 */
public record SystemActivityEvent(
    String activity,
    String entityType,
    String entityId,
    LocalDateTime occurredAt
) {}
