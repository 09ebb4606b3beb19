package com.phillippitts.livetranslate.domain;

import java.time.Instant;

/**
 * Audit record of a presenter transcription.
 */
public record TranscriptRecord(String sessionId, String language, String text, Instant timestamp) {
}
