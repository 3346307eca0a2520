package com.assessval.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Default sink for activity events: writes them to the application log once
 * the emitting transaction has committed. Rolled-back work leaves no trace.
 */
@Component
@Slf4j
public class SystemActivityLogListener {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onActivity(SystemActivityEvent event) {
        log.info("[activity] {} ({} {}) at {}",
            event.activity(), event.entityType(), event.entityId(), event.occurredAt());
    }
}
