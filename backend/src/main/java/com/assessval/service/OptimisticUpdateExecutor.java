package com.assessval.service;

import com.assessval.exception.ConcurrentUpdateConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a read-diff-write unit of work in its own transaction and re-runs it
 * from a fresh read when it loses an optimistic-lock race. Each attempt
 * re-reads the entity and re-computes the lineage diff, so no batch is ever
 * computed against a stale snapshot. Once attempts are exhausted the caller
 * gets a {@link ConcurrentUpdateConflictException}.
 *
 * Must be called outside of any surrounding transaction; inside one, a failed
 * attempt would poison the outer transaction.
 */
@Component
@Slf4j
public class OptimisticUpdateExecutor {

    private final RetryTemplate retryTemplate;
    private final TransactionTemplate transactionTemplate;

    public OptimisticUpdateExecutor(
            @Qualifier("optimisticRetryTemplate") RetryTemplate retryTemplate,
            PlatformTransactionManager transactionManager) {
        this.retryTemplate = retryTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T execute(String entityKind, String entityId, Supplier<T> work) {
        int[] attempts = {0};
        try {
            return retryTemplate.execute(context -> {
                attempts[0] = context.getRetryCount() + 1;
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying update of {} {} after concurrent modification (attempt {})",
                        entityKind, entityId, attempts[0]);
                }
                return transactionTemplate.execute(status -> work.get());
            });
        } catch (OptimisticLockingFailureException e) {
            log.warn("Giving up on {} {} after {} attempts", entityKind, entityId, attempts[0]);
            throw new ConcurrentUpdateConflictException(entityKind, entityId, attempts[0], e);
        }
    }
}
