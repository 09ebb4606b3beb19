package com.phillippitts.livetranslate.service.status;

import java.time.Instant;
import java.util.List;

public record ActiveSessions(List<SessionStatus> activeSessions, int totalActiveSessions, Instant lastUpdated) {
}
