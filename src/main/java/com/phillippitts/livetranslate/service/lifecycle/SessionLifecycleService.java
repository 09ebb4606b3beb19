package com.phillippitts.livetranslate.service.lifecycle;

import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.domain.SessionQuality;
import com.phillippitts.livetranslate.domain.SessionUpdate;
import com.phillippitts.livetranslate.exception.PersistenceException;
import com.phillippitts.livetranslate.service.persistence.SessionRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Explicit session state transitions used by message handlers and connection close.
 *
 * <p>The {@code active} flag follows a two-state machine: a created session is active; a sweep
 * rule, {@link #endSession} or duplicate cleanup ends it; only {@link #reactivateSession} or a
 * listener joining brings it back.
 *
 * <p><b>Error Handling:</b> every method runs on the real-time path, so repository failures
 * are logged and reported as an empty result. They never propagate to the caller.
 */
@Service
public class SessionLifecycleService {

    private static final Logger LOG = LogManager.getLogger(SessionLifecycleService.class);

    static final String GRACE_PERIOD_REASON = "All listeners disconnected - grace period active";
    static final String DUPLICATE_SESSION_REASON = "Duplicate session - presenter created new session";

    private final SessionRepository repository;
    private final Clock clock;

    public SessionLifecycleService(SessionRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts the grace countdown after the last listener left: resets lastActivityAt so the
     * abandoned rule measures from now. Inactive sessions are left untouched.
     */
    public Optional<PersistedSession> markAllListenersLeft(String sessionId) {
        Optional<PersistedSession> result = update("markAllListenersLeft", sessionId, PersistedSession::active,
                SessionUpdate.create()
                        .lastActivityAt(clock.instant())
                        .qualityReason(GRACE_PERIOD_REASON));
        result.ifPresent(s -> LOG.info("All listeners left session {}; grace period started", sessionId));
        return result;
    }

    /**
     * Clears the grace marker when a listener returns. Does not change {@code active}.
     */
    public Optional<PersistedSession> markListenersRejoined(String sessionId) {
        Optional<PersistedSession> result = update("markListenersRejoined", sessionId, s -> true,
                SessionUpdate.create()
                        .lastActivityAt(clock.instant())
                        .qualityReason(null));
        result.ifPresent(s -> LOG.info("Listeners rejoined session {}; grace period cleared", sessionId));
        return result;
    }

    /**
     * Terminal transition of an active session.
     *
     * @return the ended session, or empty if it was missing or already inactive
     */
    public Optional<PersistedSession> endSession(String sessionId, String reason) {
        Optional<PersistedSession> result = update("endSession", sessionId, PersistedSession::active,
                SessionUpdate.create()
                        .active(false)
                        .endTime(clock.instant())
                        .quality(SessionQuality.NO_ACTIVITY)
                        .qualityReason(reason));
        result.ifPresent(s -> LOG.info("Ended session {}: {}", sessionId, reason));
        return result;
    }

    public Optional<PersistedSession> findActiveSessionByPresenterId(String presenterId) {
        try {
            return repository.findActiveByPresenterId(presenterId);
        } catch (PersistenceException e) {
            LOG.warn("Could not look up active session for presenter {}: {}", presenterId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Most recent ended session of a presenter that ended (or last saw activity) within the window.
     */
    public Optional<PersistedSession> findRecentSessionByPresenterId(String presenterId, int withinMinutes) {
        Instant since = clock.instant().minus(Duration.ofMinutes(withinMinutes));
        try {
            return repository.findRecentInactiveByPresenterId(presenterId, since);
        } catch (PersistenceException e) {
            LOG.warn("Could not look up recent session for presenter {}: {}", presenterId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Flips an ended session back to active and clears its end time.
     *
     * @return the reactivated session; empty when there is nothing to do because the session
     *         is already active or does not exist
     */
    public Optional<PersistedSession> reactivateSession(String sessionId) {
        Optional<PersistedSession> result = update("reactivateSession", sessionId, s -> !s.active(),
                SessionUpdate.create()
                        .active(true)
                        .endTime(null)
                        .qualityReason(null)
                        .lastActivityAt(clock.instant()));
        result.ifPresent(s -> LOG.info("Reactivated session {}", sessionId));
        return result;
    }

    /**
     * Ends every other active session in the same presenter language, so a reconnect storm
     * cannot leave several live rooms for one presenter.
     *
     * @return number of sessions ended
     */
    public int endDuplicatePresenterSessions(String currentSessionId, String presenterLanguage) {
        if (presenterLanguage == null) {
            return 0;
        }
        int ended = 0;
        try {
            for (PersistedSession s : repository.findActiveSessions()) {
                if (s.sessionId().equals(currentSessionId) || !presenterLanguage.equals(s.presenterLanguage())) {
                    continue;
                }
                if (endSession(s.sessionId(), DUPLICATE_SESSION_REASON).isPresent()) {
                    ended++;
                }
            }
        } catch (PersistenceException e) {
            LOG.warn("Duplicate session cleanup for {} failed: {}", currentSessionId, e.getMessage());
        }
        if (ended > 0) {
            LOG.info("Ended {} duplicate {} sessions in favour of {}", ended, presenterLanguage, currentSessionId);
        }
        return ended;
    }

    /**
     * Intent only: listeners of {@code fromSessionId} are not moved. They keep their session id
     * and rejoin through the restored classroom code.
     */
    public void migrateOrphanedListeners(String fromSessionId, String toSessionId) {
        if (fromSessionId == null || fromSessionId.equals(toSessionId)) {
            return;
        }
        LOG.info("Listeners of session {} would migrate to {}; migration is not performed", fromSessionId,
                toSessionId);
    }

    /**
     * Records a listener joining a session: creates the durable session on first join,
     * otherwise refreshes it, reactivating an ended session and clearing a pending grace period.
     *
     * @param countConnection true if this connection has not been counted yet
     * @return the stored session after the join, or empty if persistence failed
     */
    public Optional<ListenerJoin> recordListenerJoin(String sessionId, String presenterId, String presenterLanguage,
                                                     String listenerLanguage, String classCode,
                                                     boolean countConnection) {
        Instant now = clock.instant();
        try {
            Optional<PersistedSession> existing = repository.getSessionById(sessionId);
            if (existing.isEmpty()) {
                PersistedSession started = PersistedSession.started(sessionId, presenterLanguage, listenerLanguage,
                        classCode, countConnection ? 1 : 0, now);
                if (presenterId != null) {
                    started = SessionUpdate.create().presenterId(presenterId).applyTo(started);
                }
                try {
                    PersistedSession created = repository.createSession(started);
                    LOG.info("Created session {} on first listener join ({} -> {})", sessionId,
                            presenterLanguage, listenerLanguage);
                    return Optional.of(new ListenerJoin(created, true, false));
                } catch (PersistenceException raced) {
                    // another listener created it concurrently; fall through to the update path
                    existing = repository.getSessionById(sessionId);
                    if (existing.isEmpty()) {
                        throw raced;
                    }
                }
            }

            PersistedSession before = existing.get();
            SessionUpdate update = SessionUpdate.create()
                    .lastActivityAt(now)
                    .listenerLanguage(listenerLanguage);
            if (countConnection) {
                update.incrementListenerCount(1);
            }
            boolean reactivate = !before.active();
            if (reactivate) {
                update.active(true).endTime(null);
            }
            if (reactivate || GRACE_PERIOD_REASON.equals(before.qualityReason())) {
                update.qualityReason(null);
            }
            if (classCode != null && before.classCode() == null) {
                update.classCode(classCode);
            }
            Optional<PersistedSession> after = repository.updateSession(sessionId, update);
            if (reactivate) {
                LOG.info("Listener joined ended session {}; reactivated", sessionId);
            } else if (GRACE_PERIOD_REASON.equals(before.qualityReason())) {
                LOG.info("Listeners rejoined session {}; grace period cleared", sessionId);
            }
            return after.map(s -> new ListenerJoin(s, false, reactivate));
        } catch (PersistenceException e) {
            LOG.warn("Could not record listener join for session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Updates presenter details on an existing session; no-op if the session has not been created.
     */
    public Optional<PersistedSession> updatePresenter(String sessionId, String presenterId, String presenterLanguage) {
        SessionUpdate update = SessionUpdate.create().presenterLanguage(presenterLanguage);
        if (presenterId != null) {
            update.presenterId(presenterId);
        }
        return update("updatePresenter", sessionId, s -> true, update);
    }

    private Optional<PersistedSession> update(String operation, String sessionId,
                                              Predicate<PersistedSession> condition,
                                              SessionUpdate update) {
        if (sessionId == null) {
            return Optional.empty();
        }
        try {
            return repository.updateSessionIf(sessionId, condition, update);
        } catch (PersistenceException e) {
            LOG.warn("{} failed for session {}: {}", operation, sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Result of {@link #recordListenerJoin}.
     */
    public record ListenerJoin(PersistedSession session, boolean created, boolean reactivated) {
    }
}
