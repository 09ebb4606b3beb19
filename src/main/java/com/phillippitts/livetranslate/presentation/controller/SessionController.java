package com.phillippitts.livetranslate.presentation.controller;

import com.phillippitts.livetranslate.service.status.ActiveSessions;
import com.phillippitts.livetranslate.service.status.SessionStatus;
import com.phillippitts.livetranslate.service.status.SessionStatusService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session status for dashboards: connected listeners and their language mix.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final SessionStatusService statusService;

    SessionController(SessionStatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping("/{sessionId}/status")
    ResponseEntity<ApiResponse<SessionStatus>> status(@PathVariable String sessionId) {
        LOG.debug("Status requested for session {}", sessionId);
        return ResponseEntity.ok(ApiResponse.ok(statusService.getSessionStatus(sessionId)));
    }

    @GetMapping("/active")
    ResponseEntity<ApiResponse<ActiveSessions>> active() {
        ActiveSessions sessions = statusService.getActiveSessions();
        LOG.info("Active sessions requested: {}", sessions.totalActiveSessions());
        return ResponseEntity.ok(ApiResponse.ok(sessions));
    }
}
