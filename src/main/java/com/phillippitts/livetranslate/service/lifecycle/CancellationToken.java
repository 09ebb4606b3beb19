package com.phillippitts.livetranslate.service.lifecycle;

/**
 * Cooperative stop signal for periodic work.
 *
 * <p>Tasks check {@link #isCancelled()} immediately before and after every repository call;
 * once cancelled, a sweep already in flight returns without touching further state.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
