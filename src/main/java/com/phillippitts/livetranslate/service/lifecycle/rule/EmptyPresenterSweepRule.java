package com.phillippitts.livetranslate.service.lifecycle.rule;

import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.domain.SessionQuality;
import com.phillippitts.livetranslate.util.TimeUtils;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Ends sessions no listener ever joined within the timeout of their start.
 */
public class EmptyPresenterSweepRule extends AbstractSweepRule {

    public static final String NAME = "empty-presenter";

    private final long timeoutMs;

    public EmptyPresenterSweepRule(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected boolean doMatches(PersistedSession session, Instant now) {
        return session.listenerCount() == 0 && TimeUtils.isOlderThan(session.startTime(), now, timeoutMs);
    }

    @Override
    protected SessionQuality quality() {
        return SessionQuality.NO_LISTENERS;
    }

    @Override
    protected String reason() {
        return "No listeners joined within " + TimeUnit.MILLISECONDS.toMinutes(timeoutMs) + " minutes";
    }
}
