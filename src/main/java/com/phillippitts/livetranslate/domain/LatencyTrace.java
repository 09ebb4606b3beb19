package com.phillippitts.livetranslate.domain;

import com.phillippitts.livetranslate.util.TimeUtils;

/**
 * Multi-stage latency of one broadcast, measured from the moment the transcription arrived.
 *
 * <p>The translation phase is shared by every listener; synthesis is per listener, so each
 * delivery derives its own trace with {@link #withSynthesis(long)}. Processing is whatever
 * the measured stages do not account for, which keeps the components summing to the total.
 */
public record LatencyTrace(long startNanos, long preparationMs, long translationMs, long synthesisMs) {

    public static LatencyTrace begin() {
        return new LatencyTrace(System.nanoTime(), 0, 0, 0);
    }

    public LatencyTrace withPreparation(long ms) {
        return new LatencyTrace(startNanos, ms, translationMs, synthesisMs);
    }

    public LatencyTrace withTranslation(long ms) {
        return new LatencyTrace(startNanos, preparationMs, ms, synthesisMs);
    }

    public LatencyTrace withSynthesis(long ms) {
        return new LatencyTrace(startNanos, preparationMs, translationMs, ms);
    }

    public Breakdown complete(long serverCompleteTimeMillis) {
        return complete(System.nanoTime(), serverCompleteTimeMillis);
    }

    /**
     * Closes the trace at {@code nowNanos}.
     */
    public Breakdown complete(long nowNanos, long serverCompleteTimeMillis) {
        long total = Math.max(0, TimeUtils.nanosToMillis(nowNanos - startNanos));
        long processing = Math.max(0, total - preparationMs - translationMs - synthesisMs);
        return new Breakdown(total, serverCompleteTimeMillis, preparationMs, translationMs, synthesisMs, processing);
    }

    /**
     * Finished latency figures reported to the listener.
     */
    public record Breakdown(long totalMs, long serverCompleteTime, long preparationMs, long translationMs,
                            long synthesisMs, long processingMs) {

        public long componentSum() {
            return preparationMs + translationMs + synthesisMs + processingMs;
        }
    }
}
