package com.phillippitts.livetranslate.service.persistence;

import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.domain.SessionUpdate;
import com.phillippitts.livetranslate.domain.TranscriptRecord;
import com.phillippitts.livetranslate.domain.TranslationRecord;
import com.phillippitts.livetranslate.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Process-local {@link SessionRepository}. Records are immutable, so reads hand out the stored
 * instance without copying; updates replace it inside {@link Map#computeIfPresent}.
 */
@Repository
public class InMemorySessionRepository implements SessionRepository {

    private static final Logger LOG = LogManager.getLogger(InMemorySessionRepository.class);

    private final Map<String, PersistedSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<TranscriptRecord>> transcripts = new ConcurrentHashMap<>();
    private final Map<String, List<TranslationRecord>> translations = new ConcurrentHashMap<>();

    @Override
    public PersistedSession createSession(PersistedSession session) {
        Objects.requireNonNull(session, "session");
        PersistedSession previous = sessions.putIfAbsent(session.sessionId(), session);
        if (previous != null) {
            throw new PersistenceException("createSession", "session " + session.sessionId() + " already exists");
        }
        LOG.debug("Created session {}", session.sessionId());
        return session;
    }

    @Override
    public Optional<PersistedSession> updateSession(String sessionId, SessionUpdate update) {
        return updateSessionIf(sessionId, s -> true, update);
    }

    @Override
    public Optional<PersistedSession> updateSessionIf(String sessionId, Predicate<PersistedSession> condition,
                                                      SessionUpdate update) {
        if (sessionId == null) {
            return Optional.empty();
        }
        boolean[] applied = new boolean[1];
        PersistedSession result = sessions.computeIfPresent(sessionId, (id, current) -> {
            if (!condition.test(current)) {
                return current;
            }
            applied[0] = true;
            return update.applyTo(current);
        });
        return applied[0] ? Optional.ofNullable(result) : Optional.empty();
    }

    @Override
    public Optional<PersistedSession> getActiveSession(String sessionId) {
        return getSessionById(sessionId).filter(PersistedSession::active);
    }

    @Override
    public Optional<PersistedSession> getSessionById(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public List<PersistedSession> findActiveSessions() {
        return sessions.values().stream().filter(PersistedSession::active).toList();
    }

    @Override
    public Optional<PersistedSession> findActiveByPresenterId(String presenterId) {
        if (presenterId == null) {
            return Optional.empty();
        }
        return sessions.values().stream()
                .filter(s -> s.active() && presenterId.equals(s.presenterId()))
                .max(Comparator.comparing(PersistedSession::startTime));
    }

    @Override
    public Optional<PersistedSession> findRecentInactiveByPresenterId(String presenterId, Instant since) {
        if (presenterId == null) {
            return Optional.empty();
        }
        return sessions.values().stream()
                .filter(s -> !s.active() && presenterId.equals(s.presenterId()))
                .filter(s -> {
                    Instant last = lastSeen(s);
                    return last != null && !last.isBefore(since);
                })
                .max(Comparator.comparing(InMemorySessionRepository::lastSeen));
    }

    @Override
    public void addTranscript(TranscriptRecord record) {
        transcripts.computeIfAbsent(record.sessionId(), k -> new CopyOnWriteArrayList<>()).add(record);
    }

    @Override
    public void addTranslation(TranslationRecord record) {
        translations.computeIfAbsent(record.sessionId(), k -> new CopyOnWriteArrayList<>()).add(record);
    }

    @Override
    public List<TranscriptRecord> getTranscripts(String sessionId) {
        return List.copyOf(transcripts.getOrDefault(sessionId, List.of()));
    }

    @Override
    public List<TranslationRecord> getTranslations(String sessionId) {
        return List.copyOf(translations.getOrDefault(sessionId, List.of()));
    }

    private static Instant lastSeen(PersistedSession s) {
        return s.endTime() != null ? s.endTime() : s.lastActivityAt();
    }
}
