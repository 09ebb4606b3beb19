package com.phillippitts.livetranslate.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the session reaper and presenter reconnect window.
 *
 * <p>The all-listeners-left timeout must be shorter than the stale timeout: the abandoned
 * rule only matches sessions idle for a duration strictly between the two.
 */
@ConfigurationProperties(prefix = "live-translate.lifecycle")
@Validated
public class SessionLifecycleProperties {

    /** Enable/disable the periodic reaper. */
    private boolean enabled = true;

    @Positive(message = "Sweep interval must be positive")
    private long sweepIntervalMs = 2 * 60 * 1000L;

    /** A session with no listener this long after start is ended (15 minutes). */
    @Positive(message = "Empty presenter timeout must be positive")
    private long emptyPresenterTimeoutMs = 15 * 60 * 1000L;

    /** Grace period after the last listener left (10 minutes). */
    @Positive(message = "All-listeners-left timeout must be positive")
    private long allListenersLeftTimeoutMs = 10 * 60 * 1000L;

    /** Any session idle this long is ended (90 minutes). */
    @Positive(message = "Stale timeout must be positive")
    private long staleTimeoutMs = 90 * 60 * 1000L;

    /** How far back a presenter reconnect may reclaim an ended session. */
    @Positive(message = "Presenter reconnect window must be positive")
    private int presenterReconnectWindowMinutes = 10;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public long getEmptyPresenterTimeoutMs() {
        return emptyPresenterTimeoutMs;
    }

    public void setEmptyPresenterTimeoutMs(long emptyPresenterTimeoutMs) {
        this.emptyPresenterTimeoutMs = emptyPresenterTimeoutMs;
    }

    public long getAllListenersLeftTimeoutMs() {
        return allListenersLeftTimeoutMs;
    }

    public void setAllListenersLeftTimeoutMs(long allListenersLeftTimeoutMs) {
        this.allListenersLeftTimeoutMs = allListenersLeftTimeoutMs;
    }

    public long getStaleTimeoutMs() {
        return staleTimeoutMs;
    }

    public void setStaleTimeoutMs(long staleTimeoutMs) {
        this.staleTimeoutMs = staleTimeoutMs;
    }

    public int getPresenterReconnectWindowMinutes() {
        return presenterReconnectWindowMinutes;
    }

    public void setPresenterReconnectWindowMinutes(int presenterReconnectWindowMinutes) {
        this.presenterReconnectWindowMinutes = presenterReconnectWindowMinutes;
    }
}
