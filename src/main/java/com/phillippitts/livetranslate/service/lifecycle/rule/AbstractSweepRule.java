package com.phillippitts.livetranslate.service.lifecycle.rule;

import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.domain.SessionQuality;
import com.phillippitts.livetranslate.domain.SessionUpdate;
import com.phillippitts.livetranslate.exception.PersistenceException;
import com.phillippitts.livetranslate.service.lifecycle.CancellationToken;
import com.phillippitts.livetranslate.service.persistence.SessionRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Template for rules that end active sessions matching a time-based predicate.
 *
 * <p>{@link #apply} loads the active sessions, then ends each match with a conditional update
 * that re-evaluates the predicate against the stored record, so a session changed between the
 * read and the write (a listener rejoined, another rule ended it) is left alone.
 *
 * <p><b>Cancellation:</b> the token is checked immediately before and after every repository
 * call. A cancelled sweep stops without further writes and without surfacing an error.
 *
 * <p>Subclasses implement {@link #doMatches} for active sessions only, plus the quality and
 * reason recorded on the ended session.
 */
public abstract class AbstractSweepRule implements SweepRule {

    private static final Logger LOG = LogManager.getLogger(AbstractSweepRule.class);

    @Override
    public final boolean matches(PersistedSession session, Instant now) {
        return session.active() && doMatches(session, now);
    }

    @Override
    public final int apply(SessionRepository repository, CancellationToken token, Instant now) {
        if (token.isCancelled()) {
            return 0;
        }
        List<PersistedSession> active;
        try {
            active = repository.findActiveSessions();
        } catch (PersistenceException e) {
            LOG.warn("Rule {} could not load active sessions: {}", name(), e.getMessage());
            return 0;
        }
        if (token.isCancelled()) {
            LOG.debug("Rule {} cancelled after loading sessions", name());
            return 0;
        }

        int ended = 0;
        for (PersistedSession candidate : active) {
            if (!matches(candidate, now)) {
                continue;
            }
            if (token.isCancelled()) {
                LOG.debug("Rule {} cancelled before ending {}", name(), candidate.sessionId());
                break;
            }
            Optional<PersistedSession> result;
            try {
                result = repository.updateSessionIf(candidate.sessionId(), current -> matches(current, now),
                        SessionUpdate.create()
                                .active(false)
                                .quality(quality())
                                .qualityReason(reason())
                                .endTime(now));
            } catch (PersistenceException e) {
                LOG.warn("Rule {} failed to end session {}: {}", name(), candidate.sessionId(), e.getMessage());
                continue;
            }
            if (result.isPresent()) {
                ended++;
                LOG.info("Ended session {} by rule {}: {}", candidate.sessionId(), name(), reason());
            }
            if (token.isCancelled()) {
                LOG.debug("Rule {} cancelled after ending {}", name(), candidate.sessionId());
                break;
            }
        }
        return ended;
    }

    /**
     * Predicate for an active session.
     */
    protected abstract boolean doMatches(PersistedSession session, Instant now);

    protected abstract SessionQuality quality();

    protected abstract String reason();

    /** Last activity, falling back to start time for sessions that never recorded activity. */
    protected static Instant lastActivityOf(PersistedSession session) {
        return session.lastActivityAt() != null ? session.lastActivityAt() : session.startTime();
    }
}
