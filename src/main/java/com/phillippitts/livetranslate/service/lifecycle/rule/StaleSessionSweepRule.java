package com.phillippitts.livetranslate.service.lifecycle.rule;

import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.domain.SessionQuality;
import com.phillippitts.livetranslate.util.TimeUtils;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Ends any session idle longer than the stale threshold, regardless of listeners.
 */
public class StaleSessionSweepRule extends AbstractSweepRule {

    public static final String NAME = "stale";

    private final long staleMs;

    public StaleSessionSweepRule(long staleMs) {
        this.staleMs = staleMs;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected boolean doMatches(PersistedSession session, Instant now) {
        return TimeUtils.isOlderThan(lastActivityOf(session), now, staleMs);
    }

    @Override
    protected SessionQuality quality() {
        return SessionQuality.NO_ACTIVITY;
    }

    @Override
    protected String reason() {
        return "Session inactive for more than " + TimeUnit.MILLISECONDS.toMinutes(staleMs) + " minutes";
    }
}
