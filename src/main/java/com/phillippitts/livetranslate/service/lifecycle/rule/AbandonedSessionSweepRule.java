package com.phillippitts.livetranslate.service.lifecycle.rule;

import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.domain.SessionQuality;
import com.phillippitts.livetranslate.util.TimeUtils;

import java.time.Instant;

/**
 * Ends sessions whose listeners all left and whose grace period ran out.
 *
 * <p>Matches only when the idle duration lies strictly between the grace period and the
 * stale threshold; anything idle longer belongs to {@link StaleSessionSweepRule}.
 */
public class AbandonedSessionSweepRule extends AbstractSweepRule {

    public static final String NAME = "abandoned";

    private final long gracePeriodMs;
    private final long staleMs;

    public AbandonedSessionSweepRule(long gracePeriodMs, long staleMs) {
        if (gracePeriodMs >= staleMs) {
            throw new IllegalArgumentException("grace period (" + gracePeriodMs
                    + " ms) must be shorter than the stale threshold (" + staleMs + " ms)");
        }
        this.gracePeriodMs = gracePeriodMs;
        this.staleMs = staleMs;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected boolean doMatches(PersistedSession session, Instant now) {
        if (session.listenerCount() <= 0) {
            return false;
        }
        Instant last = lastActivityOf(session);
        return last.isBefore(TimeUtils.cutoff(now, gracePeriodMs))
                && last.isAfter(TimeUtils.cutoff(now, staleMs));
    }

    @Override
    protected SessionQuality quality() {
        return SessionQuality.NO_ACTIVITY;
    }

    @Override
    protected String reason() {
        return "All listeners left and the grace period expired";
    }
}
