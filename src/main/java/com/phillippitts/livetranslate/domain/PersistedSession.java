package com.phillippitts.livetranslate.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable record of a classroom session's lifecycle and counters.
 *
 * <p>Immutable; repositories apply a {@link SessionUpdate} to produce the next version.
 * {@code active == false} is terminal unless the session is explicitly reactivated.
 */
public record PersistedSession(
        String sessionId,
        String presenterId,
        String presenterLanguage,
        String listenerLanguage,
        String classCode,
        int listenerCount,
        int totalDeliveries,
        boolean active,
        SessionQuality quality,
        String qualityReason,
        Instant lastActivityAt,
        Instant startTime,
        Instant endTime
) {

    public PersistedSession {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(startTime, "startTime");
        if (listenerCount < 0) {
            throw new IllegalArgumentException("listenerCount must be >= 0");
        }
        quality = quality == null ? SessionQuality.UNKNOWN : quality;
    }

    /**
     * A freshly created, active session.
     */
    public static PersistedSession started(String sessionId, String presenterLanguage, String listenerLanguage,
                                           String classCode, int listenerCount, Instant now) {
        return new PersistedSession(sessionId, null, presenterLanguage, listenerLanguage, classCode,
                listenerCount, 0, true, SessionQuality.UNKNOWN, null, now, now, null);
    }
}
