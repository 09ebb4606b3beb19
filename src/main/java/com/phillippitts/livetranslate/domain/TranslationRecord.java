package com.phillippitts.livetranslate.domain;

import java.time.Instant;

/**
 * Audit record of one delivered translation, persisted only when enabled by configuration.
 */
public record TranslationRecord(
        String sessionId,
        String sourceLanguage,
        String targetLanguage,
        String originalText,
        String translatedText,
        long latencyMs,
        Instant timestamp
) {
}
