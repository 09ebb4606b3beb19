package com.phillippitts.livetranslate.service.status;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Live view of one session combining registry presence with the stored record.
 *
 * @param classCode current classroom code, null when none is live
 * @param active    stored active flag; true for sessions not persisted yet but with connections
 */
public record SessionStatus(
        String sessionId,
        String classCode,
        int connectedListeners,
        List<LanguageShare> languages,
        @JsonProperty("isActive") boolean active,
        Instant lastUpdated
) {
}
