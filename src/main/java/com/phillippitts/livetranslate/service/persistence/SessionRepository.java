package com.phillippitts.livetranslate.service.persistence;

import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.domain.SessionUpdate;
import com.phillippitts.livetranslate.domain.TranscriptRecord;
import com.phillippitts.livetranslate.domain.TranslationRecord;
import com.phillippitts.livetranslate.exception.PersistenceException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Durable storage of session records and their audit trail.
 *
 * <p>Every method may throw {@link PersistenceException}. Callers on the real-time path
 * (handlers, fan-out) log and continue; the reaper logs and moves to the next session.
 */
public interface SessionRepository {

    /**
     * Stores a new session.
     *
     * @return the stored record
     * @throws PersistenceException if a session with the same id already exists
     */
    PersistedSession createSession(PersistedSession session);

    /**
     * Applies a partial update.
     *
     * @return the updated record, or empty if the session does not exist
     */
    Optional<PersistedSession> updateSession(String sessionId, SessionUpdate update);

    /**
     * Applies a partial update only if {@code condition} holds for the current record, atomically
     * with respect to other updates of the same session.
     *
     * @return the updated record, or empty if the session does not exist or the condition failed
     */
    Optional<PersistedSession> updateSessionIf(String sessionId, Predicate<PersistedSession> condition,
                                               SessionUpdate update);

    /** The session if it exists and is active. */
    Optional<PersistedSession> getActiveSession(String sessionId);

    Optional<PersistedSession> getSessionById(String sessionId);

    List<PersistedSession> findActiveSessions();

    /** Most recently started active session of a presenter. */
    Optional<PersistedSession> findActiveByPresenterId(String presenterId);

    /**
     * Most recent inactive session of a presenter whose end time, or last activity when no end
     * time was recorded, is at or after {@code since}.
     */
    Optional<PersistedSession> findRecentInactiveByPresenterId(String presenterId, Instant since);

    void addTranscript(TranscriptRecord record);

    void addTranslation(TranslationRecord record);

    List<TranscriptRecord> getTranscripts(String sessionId);

    List<TranslationRecord> getTranslations(String sessionId);
}
