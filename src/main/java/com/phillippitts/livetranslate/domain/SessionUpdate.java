package com.phillippitts.livetranslate.domain;

import java.time.Instant;

/**
 * Partial update of a {@link PersistedSession}. Unset fields are left unchanged.
 *
 * <p>{@code qualityReason} and {@code endTime} can be cleared explicitly, so each tracks
 * whether it was set separately from its value.
 */
public final class SessionUpdate {

    private Boolean active;
    private SessionQuality quality;
    private boolean qualityReasonSet;
    private String qualityReason;
    private Instant lastActivityAt;
    private boolean endTimeSet;
    private Instant endTime;
    private Integer listenerCount;
    private int listenerCountDelta;
    private Integer totalDeliveries;
    private int totalDeliveriesDelta;
    private String presenterId;
    private String presenterLanguage;
    private String listenerLanguage;
    private String classCode;

    private SessionUpdate() {
    }

    public static SessionUpdate create() {
        return new SessionUpdate();
    }

    public SessionUpdate active(boolean value) {
        this.active = value;
        return this;
    }

    public SessionUpdate quality(SessionQuality value) {
        this.quality = value;
        return this;
    }

    public SessionUpdate qualityReason(String value) {
        this.qualityReasonSet = true;
        this.qualityReason = value;
        return this;
    }

    public SessionUpdate lastActivityAt(Instant value) {
        this.lastActivityAt = value;
        return this;
    }

    public SessionUpdate endTime(Instant value) {
        this.endTimeSet = true;
        this.endTime = value;
        return this;
    }

    public SessionUpdate listenerCount(int value) {
        this.listenerCount = value;
        return this;
    }

    /** Adds to the stored listenerCount at apply time, so concurrent joins do not lose increments. */
    public SessionUpdate incrementListenerCount(int delta) {
        this.listenerCountDelta += delta;
        return this;
    }

    /** Adds to the stored totalDeliveries at apply time. */
    public SessionUpdate incrementTotalDeliveries(int delta) {
        this.totalDeliveriesDelta += delta;
        return this;
    }

    public SessionUpdate totalDeliveries(int value) {
        this.totalDeliveries = value;
        return this;
    }

    public SessionUpdate presenterId(String value) {
        this.presenterId = value;
        return this;
    }

    public SessionUpdate presenterLanguage(String value) {
        this.presenterLanguage = value;
        return this;
    }

    public SessionUpdate listenerLanguage(String value) {
        this.listenerLanguage = value;
        return this;
    }

    public SessionUpdate classCode(String value) {
        this.classCode = value;
        return this;
    }

    /**
     * Produces the next version of {@code current} with this update's set fields applied.
     */
    public PersistedSession applyTo(PersistedSession current) {
        return new PersistedSession(
                current.sessionId(),
                presenterId != null ? presenterId : current.presenterId(),
                presenterLanguage != null ? presenterLanguage : current.presenterLanguage(),
                listenerLanguage != null ? listenerLanguage : current.listenerLanguage(),
                classCode != null ? classCode : current.classCode(),
                (listenerCount != null ? listenerCount : current.listenerCount()) + listenerCountDelta,
                (totalDeliveries != null ? totalDeliveries : current.totalDeliveries()) + totalDeliveriesDelta,
                active != null ? active : current.active(),
                quality != null ? quality : current.quality(),
                qualityReasonSet ? qualityReason : current.qualityReason(),
                lastActivityAt != null ? lastActivityAt : current.lastActivityAt(),
                current.startTime(),
                endTimeSet ? endTime : current.endTime());
    }

    @Override
    public String toString() {
        return "SessionUpdate{active=" + active + ", quality=" + quality
                + ", qualityReason=" + (qualityReasonSet ? qualityReason : "<unchanged>")
                + ", lastActivityAt=" + lastActivityAt
                + ", endTime=" + (endTimeSet ? endTime : "<unchanged>")
                + ", listenerCount=" + listenerCount + "+" + listenerCountDelta
                + ", totalDeliveries=" + totalDeliveries + "+" + totalDeliveriesDelta + '}';
    }
}
