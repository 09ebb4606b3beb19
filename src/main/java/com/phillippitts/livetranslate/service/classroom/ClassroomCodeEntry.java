package com.phillippitts.livetranslate.service.classroom;

import java.time.Instant;

/**
 * One classroom code binding. Immutable; the directory replaces entries on renewal.
 */
public record ClassroomCodeEntry(
        String code,
        String sessionId,
        Instant createdAt,
        Instant lastActivity,
        Instant expiresAt,
        boolean presenterConnected
) {

    /** Valid strictly before {@code expiresAt}; expired at and after it. */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    ClassroomCodeEntry renewed(Instant now, Instant newExpiry) {
        return new ClassroomCodeEntry(code, sessionId, createdAt, now, newExpiry, presenterConnected);
    }

    ClassroomCodeEntry withPresenterConnected(boolean connected, Instant now) {
        return new ClassroomCodeEntry(code, sessionId, createdAt, now, expiresAt, connected);
    }
}
