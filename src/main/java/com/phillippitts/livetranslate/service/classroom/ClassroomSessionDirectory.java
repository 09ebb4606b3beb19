package com.phillippitts.livetranslate.service.classroom;

import com.phillippitts.livetranslate.config.properties.ClassroomProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ephemeral directory mapping short classroom codes to session ids.
 *
 * <p>Codes live for a fixed TTL from their last renewal. Only {@link #generateCode(String)} and
 * {@link #restoreClassroomSession(String, String)} renew; lookups and validity checks never do.
 * A presenter reconnecting may leave an older code pointing at the same session; such codes are
 * reclaimed by expiry.
 *
 * <p>Minting and renewal are serialized on this instance so two presenters cannot receive the
 * same fresh code. Reads go straight to the concurrent map.
 */
@Component
public class ClassroomSessionDirectory {

    private static final Logger LOG = LogManager.getLogger(ClassroomSessionDirectory.class);

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int MAX_MINT_ATTEMPTS = 100;

    private final ClassroomProperties props;
    private final Clock clock;
    private final Random random;

    private final Map<String, ClassroomCodeEntry> byCode = new ConcurrentHashMap<>();

    @Autowired
    public ClassroomSessionDirectory(ClassroomProperties props, Clock clock) {
        this(props, clock, new SecureRandom());
    }

    /** Visible for tests: a seeded random makes collisions reproducible. */
    ClassroomSessionDirectory(ClassroomProperties props, Clock clock, Random random) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Returns the session's current code, renewing its TTL, or mints a new one.
     *
     * @param sessionId session the code should resolve to
     * @return code listeners join with
     */
    public synchronized ClassroomCodeEntry generateCode(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        Instant now = clock.instant();

        Optional<ClassroomCodeEntry> existing = findLiveEntry(sessionId, now);
        if (existing.isPresent()) {
            ClassroomCodeEntry renewed = existing.get().renewed(now, expiryFrom(now));
            byCode.put(renewed.code(), renewed);
            LOG.debug("Renewed classroom code {} for session {} until {}", renewed.code(), sessionId,
                    renewed.expiresAt());
            return renewed;
        }

        String code = mintUniqueCode();
        ClassroomCodeEntry entry = new ClassroomCodeEntry(code, sessionId, now, now, expiryFrom(now), true);
        byCode.put(code, entry);
        LOG.info("Created classroom code {} for session {} (expires {})", code, sessionId, entry.expiresAt());
        return entry;
    }

    /**
     * Re-binds a previously issued code to a session with a fresh TTL, used when a presenter
     * reconnects and reclaims its session.
     *
     * @return the restored entry, or empty if the code is held by a different live session
     */
    public synchronized Optional<ClassroomCodeEntry> restoreClassroomSession(String code, String sessionId) {
        String key = normalize(code);
        if (key == null || sessionId == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        ClassroomCodeEntry current = byCode.get(key);
        if (current != null && !current.isExpiredAt(now) && !current.sessionId().equals(sessionId)) {
            LOG.warn("Cannot restore code {} for session {}: held by session {}", key, sessionId,
                    current.sessionId());
            return Optional.empty();
        }
        Instant createdAt = current != null ? current.createdAt() : now;
        ClassroomCodeEntry restored = new ClassroomCodeEntry(key, sessionId, createdAt, now, expiryFrom(now), true);
        byCode.put(key, restored);
        LOG.info("Restored classroom code {} for session {}", key, sessionId);
        return Optional.of(restored);
    }

    /**
     * True iff the code exists and has not yet expired. Does not renew.
     */
    public boolean isValidCode(String code) {
        return getByCode(code).isPresent();
    }

    /** Live entry for a code, without renewing it. */
    public Optional<ClassroomCodeEntry> getByCode(String code) {
        String key = normalize(code);
        if (key == null) {
            return Optional.empty();
        }
        ClassroomCodeEntry entry = byCode.get(key);
        if (entry == null || entry.isExpiredAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /** Most recently issued live code for a session. */
    public Optional<String> getCodeBySessionId(String sessionId) {
        return findLiveEntry(sessionId, clock.instant()).map(ClassroomCodeEntry::code);
    }

    public void markPresenterDisconnected(String sessionId) {
        setPresenterConnected(sessionId, false);
    }

    public void markPresenterReconnected(String sessionId) {
        setPresenterConnected(sessionId, true);
    }

    /** Number of codes that have not expired yet. */
    public int getActiveSessionCount() {
        Instant now = clock.instant();
        return (int) byCode.values().stream().filter(e -> !e.isExpiredAt(now)).count();
    }

    /**
     * Evicts every expired entry.
     *
     * @return number of entries evicted
     */
    public int triggerCleanup() {
        Instant now = clock.instant();
        int evicted = 0;
        for (ClassroomCodeEntry entry : List.copyOf(byCode.values())) {
            if (entry.isExpiredAt(now) && evict(entry)) {
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * Removes {@code seen} only while it is still the entry stored for its code, so a code
     * restored after the cleanup read it survives.
     */
    boolean evict(ClassroomCodeEntry seen) {
        boolean removed = byCode.remove(seen.code(), seen);
        if (removed) {
            LOG.debug("Evicted expired classroom code {} (session {})", seen.code(), seen.sessionId());
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${live-translate.classroom.cleanup-interval-ms:900000}",
            initialDelayString = "${live-translate.classroom.cleanup-interval-ms:900000}")
    void scheduledCleanup() {
        int evicted = triggerCleanup();
        if (evicted > 0) {
            LOG.info("Classroom code cleanup evicted {} expired codes; {} remain", evicted, byCode.size());
        }
    }

    private void setPresenterConnected(String sessionId, boolean connected) {
        if (sessionId == null) {
            return;
        }
        Instant now = clock.instant();
        byCode.replaceAll((code, entry) ->
                sessionId.equals(entry.sessionId()) ? entry.withPresenterConnected(connected, now) : entry);
    }

    private Optional<ClassroomCodeEntry> findLiveEntry(String sessionId, Instant now) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return byCode.values().stream()
                .filter(e -> sessionId.equals(e.sessionId()) && !e.isExpiredAt(now))
                .max(Comparator.comparing(ClassroomCodeEntry::createdAt));
    }

    private String mintUniqueCode() {
        for (int attempt = 0; attempt < MAX_MINT_ATTEMPTS; attempt++) {
            String candidate = randomCode();
            if (!byCode.containsKey(candidate)) {
                return candidate;
            }
            LOG.debug("Classroom code collision on {}; retrying", candidate);
        }
        throw new IllegalStateException("Could not mint a unique classroom code after "
                + MAX_MINT_ATTEMPTS + " attempts");
    }

    private String randomCode() {
        StringBuilder sb = new StringBuilder(props.getCodeLength());
        for (int i = 0; i < props.getCodeLength(); i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    private Instant expiryFrom(Instant now) {
        return now.plus(Duration.ofMillis(props.getCodeTtlMs()));
    }

    private static String normalize(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
