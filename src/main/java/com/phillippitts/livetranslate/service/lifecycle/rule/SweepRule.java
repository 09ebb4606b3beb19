package com.phillippitts.livetranslate.service.lifecycle.rule;

import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.service.lifecycle.CancellationToken;
import com.phillippitts.livetranslate.service.persistence.SessionRepository;

import java.time.Instant;

/**
 * One independent, idempotent reaper rule.
 *
 * <p>Rules never depend on each other's outcome within a cycle: a session matched by two rules
 * ends once, by whichever runs first, and the other finds it inactive.
 */
public interface SweepRule {

    /** Short identifier used in logs and metrics. */
    String name();

    /** True if the session should be ended at {@code now}. Never true for inactive sessions. */
    boolean matches(PersistedSession session, Instant now);

    /**
     * Ends every matching active session.
     *
     * @return number of sessions this call ended
     */
    int apply(SessionRepository repository, CancellationToken token, Instant now);
}
