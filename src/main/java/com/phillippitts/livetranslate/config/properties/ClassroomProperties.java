package com.phillippitts.livetranslate.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the classroom code directory.
 */
@ConfigurationProperties(prefix = "live-translate.classroom")
@Validated
public class ClassroomProperties {

    /** Lifetime of a classroom code from its last renewal (2 hours). */
    @Positive(message = "Code TTL must be positive")
    private long codeTtlMs = 2 * 60 * 60 * 1000L;

    /** How often expired codes are evicted (15 minutes). */
    @Positive(message = "Cleanup interval must be positive")
    private long cleanupIntervalMs = 15 * 60 * 1000L;

    /** Characters in a generated code. */
    @Min(value = 4, message = "Code length must be at least 4")
    @Max(value = 12, message = "Code length must be at most 12")
    private int codeLength = 6;

    /** Delay between sending INVALID_CLASSROOM and closing the socket, so the error is flushed first. */
    @PositiveOrZero(message = "Invalid code close delay must not be negative")
    private long invalidCodeCloseDelayMs = 100;

    public long getCodeTtlMs() {
        return codeTtlMs;
    }

    public void setCodeTtlMs(long codeTtlMs) {
        this.codeTtlMs = codeTtlMs;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }

    public int getCodeLength() {
        return codeLength;
    }

    public void setCodeLength(int codeLength) {
        this.codeLength = codeLength;
    }

    public long getInvalidCodeCloseDelayMs() {
        return invalidCodeCloseDelayMs;
    }

    public void setInvalidCodeCloseDelayMs(long invalidCodeCloseDelayMs) {
        this.invalidCodeCloseDelayMs = invalidCodeCloseDelayMs;
    }
}
