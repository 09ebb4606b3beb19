package com.phillippitts.livetranslate.service.lifecycle;

import com.phillippitts.livetranslate.config.properties.SessionLifecycleProperties;
import com.phillippitts.livetranslate.service.lifecycle.rule.AbandonedSessionSweepRule;
import com.phillippitts.livetranslate.service.lifecycle.rule.EmptyPresenterSweepRule;
import com.phillippitts.livetranslate.service.lifecycle.rule.StaleSessionSweepRule;
import com.phillippitts.livetranslate.service.lifecycle.rule.SweepRule;
import com.phillippitts.livetranslate.service.metrics.LiveTranslateMetrics;
import com.phillippitts.livetranslate.service.persistence.SessionRepository;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic sweeper that ends durable sessions nobody is using.
 *
 * <p>Each cycle applies every {@link SweepRule} in order against one shared {@code now}:
 * <ul>
 *   <li><b>empty-presenter:</b> no listener joined within the empty-presenter timeout</li>
 *   <li><b>abandoned:</b> listeners left and the grace period expired, but not yet stale</li>
 *   <li><b>stale:</b> idle longer than the stale threshold</li>
 * </ul>
 * Rules are independent; when two match the same session it ends once, by whichever runs first.
 *
 * <p><b>Shutdown:</b> {@link #stop()} cancels the token shared with every rule. A cycle already
 * running stops at its next token check and performs no further writes; later ticks return
 * immediately.
 */
@Component
@ConditionalOnProperty(prefix = "live-translate.lifecycle", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class SessionLifecycleReaper {

    private static final Logger LOG = LogManager.getLogger(SessionLifecycleReaper.class);

    private final SessionRepository repository;
    private final Clock clock;
    private final LiveTranslateMetrics metrics;
    private final List<SweepRule> rules;

    private final CancellationToken token = new CancellationToken();
    private final ReentrantLock sweepLock = new ReentrantLock();

    @Autowired
    public SessionLifecycleReaper(SessionRepository repository,
                                  SessionLifecycleProperties props,
                                  Clock clock,
                                  LiveTranslateMetrics metrics) {
        this(repository, clock, metrics, defaultRules(props));
        LOG.info("Session reaper initialized: sweep every {} ms, rules={}", props.getSweepIntervalMs(),
                rules.stream().map(SweepRule::name).toList());
    }

    SessionLifecycleReaper(SessionRepository repository, Clock clock, LiveTranslateMetrics metrics,
                           List<SweepRule> rules) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.rules = List.copyOf(rules);
    }

    static List<SweepRule> defaultRules(SessionLifecycleProperties props) {
        return List.of(
                new EmptyPresenterSweepRule(props.getEmptyPresenterTimeoutMs()),
                new AbandonedSessionSweepRule(props.getAllListenersLeftTimeoutMs(), props.getStaleTimeoutMs()),
                new StaleSessionSweepRule(props.getStaleTimeoutMs()));
    }

    @Scheduled(fixedDelayString = "${live-translate.lifecycle.sweep-interval-ms:120000}",
            initialDelayString = "${live-translate.lifecycle.sweep-interval-ms:120000}")
    void scheduledSweep() {
        SweepResult result = sweep();
        if (result.totalEnded() > 0) {
            LOG.info("Session sweep ended {} sessions: {}", result.totalEnded(), result.endedByRule());
        }
    }

    /**
     * Runs one cycle now. Skipped if stopped or if another cycle is still running.
     */
    public SweepResult sweep() {
        if (token.isCancelled()) {
            return SweepResult.skipped();
        }
        if (!sweepLock.tryLock()) {
            LOG.debug("Session sweep already in progress; skipping");
            return SweepResult.skipped();
        }
        try {
            return runRules(clock.instant());
        } finally {
            sweepLock.unlock();
        }
    }

    private SweepResult runRules(Instant now) {
        Map<String, Integer> ended = new LinkedHashMap<>();
        for (SweepRule rule : rules) {
            if (token.isCancelled()) {
                LOG.debug("Session sweep cancelled before rule {}", rule.name());
                return new SweepResult(ended, true);
            }
            int count;
            try {
                count = rule.apply(repository, token, now);
            } catch (RuntimeException e) {
                LOG.error("Sweep rule {} failed", rule.name(), e);
                count = 0;
            }
            ended.put(rule.name(), count);
            metrics.incrementSessionsEnded(rule.name(), count);
        }
        return new SweepResult(ended, token.isCancelled());
    }

    /**
     * Stops the reaper: no new cycles start and an in-flight cycle aborts at its next check.
     */
    @PreDestroy
    public void stop() {
        token.cancel();
        LOG.info("Session reaper stopped");
    }

    public boolean isStopped() {
        return token.isCancelled();
    }

    /** Visible for tests */
    CancellationToken token() {
        return token;
    }
}
