package com.assessval.exception;

import lombok.Getter;

/**
 * A tracked update kept losing optimistic-lock races and ran out of attempts.
 */
@Getter
public class ConcurrentUpdateConflictException extends RuntimeException {

    private final String entityKind;
    private final String entityId;
    private final int attempts;

    public ConcurrentUpdateConflictException(String entityKind, String entityId, int attempts, Throwable cause) {
        super(String.format("Concurrent update conflict on %s %s after %d attempts", entityKind, entityId, attempts),
            cause);
        this.entityKind = entityKind;
        this.entityId = entityId;
        this.attempts = attempts;
    }
}
