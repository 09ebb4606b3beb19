package com.phillippitts.livetranslate.service.lifecycle;

import java.util.Map;

/**
 * Outcome of one reaper cycle.
 *
 * @param endedByRule sessions ended, keyed by rule name (insertion order = rule order)
 * @param aborted     true if cancellation cut the cycle short
 */
public record SweepResult(Map<String, Integer> endedByRule, boolean aborted) {

    public SweepResult {
        endedByRule = Map.copyOf(endedByRule);
    }

    public static SweepResult skipped() {
        return new SweepResult(Map.of(), true);
    }

    public int totalEnded() {
        return endedByRule.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int endedBy(String rule) {
        return endedByRule.getOrDefault(rule, 0);
    }
}
