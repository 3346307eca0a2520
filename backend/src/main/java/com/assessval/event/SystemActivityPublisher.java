package com.assessval.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Emits {@link SystemActivityEvent}s. Publication failures are logged and
 * dropped so business operations never fail because of the activity log.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SystemActivityPublisher {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void record(String activity, String entityType, String entityId) {
        try {
            eventPublisher.publishEvent(
                new SystemActivityEvent(activity, entityType, entityId, LocalDateTime.now(clock)));
        } catch (RuntimeException e) {
            log.error("Failed to publish activity '{}' for {} {}", activity, entityType, entityId, e);
        }
    }
}
