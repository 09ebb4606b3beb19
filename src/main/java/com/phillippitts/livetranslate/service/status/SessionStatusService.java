package com.phillippitts.livetranslate.service.status;

import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.exception.InvalidSessionException;
import com.phillippitts.livetranslate.exception.PersistenceException;
import com.phillippitts.livetranslate.service.classroom.ClassroomSessionDirectory;
import com.phillippitts.livetranslate.service.persistence.SessionRepository;
import com.phillippitts.livetranslate.service.registry.ConnectionRegistry;
import com.phillippitts.livetranslate.service.registry.ListenerSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only session views for the REST API.
 */
@Service
public class SessionStatusService {

    private static final Logger LOG = LogManager.getLogger(SessionStatusService.class);

    private final ConnectionRegistry registry;
    private final ClassroomSessionDirectory directory;
    private final SessionRepository repository;
    private final Clock clock;

    public SessionStatusService(ConnectionRegistry registry, ClassroomSessionDirectory directory,
                                SessionRepository repository, Clock clock) {
        this.registry = registry;
        this.directory = directory;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * @throws InvalidSessionException if the session is neither stored nor held by any connection
     */
    public SessionStatus getSessionStatus(String sessionId) {
        Optional<PersistedSession> stored = findStored(sessionId);
        boolean connected = registry.getActiveSessionIds().contains(sessionId);
        if (stored.isEmpty() && !connected) {
            throw new InvalidSessionException(sessionId, "Session not found: " + sessionId);
        }
        return statusOf(sessionId, stored);
    }

    /** Sessions with live connections plus stored sessions still marked active. */
    public ActiveSessions getActiveSessions() {
        Set<String> ids = new LinkedHashSet<>(registry.getActiveSessionIds());
        try {
            repository.findActiveSessions().forEach(s -> ids.add(s.sessionId()));
        } catch (PersistenceException e) {
            LOG.warn("Could not list stored active sessions: {}", e.getMessage());
        }
        List<SessionStatus> sessions = new ArrayList<>(ids.size());
        for (String id : ids) {
            sessions.add(statusOf(id, findStored(id)));
        }
        return new ActiveSessions(sessions, sessions.size(), clock.instant());
    }

    private SessionStatus statusOf(String sessionId, Optional<PersistedSession> stored) {
        ListenerSnapshot listeners = registry.getListenersForSession(sessionId);
        String classCode = directory.getCodeBySessionId(sessionId)
                .orElse(stored.map(PersistedSession::classCode).orElse(null));
        boolean active = stored.map(PersistedSession::active).orElse(true);
        return new SessionStatus(sessionId, classCode, listeners.size(), languageShares(listeners), active,
                clock.instant());
    }

    static List<LanguageShare> languageShares(ListenerSnapshot listeners) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String language : listeners.languages()) {
            counts.merge(language, 1, Integer::sum);
        }
        int total = listeners.size();
        List<LanguageShare> shares = new ArrayList<>(counts.size());
        counts.forEach((language, count) ->
                shares.add(new LanguageShare(language, count, Math.round(count * 100f / total))));
        return shares;
    }

    private Optional<PersistedSession> findStored(String sessionId) {
        try {
            return repository.getSessionById(sessionId);
        } catch (PersistenceException e) {
            LOG.warn("Could not load session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }
}
