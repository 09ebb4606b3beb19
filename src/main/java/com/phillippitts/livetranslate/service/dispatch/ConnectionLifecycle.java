package com.phillippitts.livetranslate.service.dispatch;

import com.phillippitts.livetranslate.domain.Role;
import com.phillippitts.livetranslate.protocol.outbound.ErrorMessage;
import com.phillippitts.livetranslate.service.classroom.ClassroomSessionDirectory;
import com.phillippitts.livetranslate.service.lifecycle.SessionLifecycleService;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import com.phillippitts.livetranslate.service.registry.ConnectionRegistry;
import com.phillippitts.livetranslate.service.registry.ConnectionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Socket open and close handling, independent of the transport.
 *
 * <p>On open the connection is registered with its own id as provisional session id, and a
 * classroom code from the URL is checked up front. On close every per-connection entry is
 * removed; the last listener leaving starts the session's grace period, and the last presenter
 * leaving is recorded in the directory.
 */
@Service
public class ConnectionLifecycle {

    private static final Logger LOG = LogManager.getLogger(ConnectionLifecycle.class);

    private final AtomicLong counter = new AtomicLong();

    private final ConnectionRegistry registry;
    private final ClassroomSessionDirectory directory;
    private final SessionLifecycleService lifecycle;
    private final ConnectionCloser closer;
    private final Clock clock;

    public ConnectionLifecycle(ConnectionRegistry registry, ClassroomSessionDirectory directory,
                               SessionLifecycleService lifecycle, ConnectionCloser closer, Clock clock) {
        this.registry = registry;
        this.directory = directory;
        this.lifecycle = lifecycle;
        this.closer = closer;
        this.clock = clock;
    }

    /** Connection ids take the form {@code session-<counter>-<epochMillis>}. */
    public String nextConnectionId() {
        return "session-" + counter.incrementAndGet() + "-" + clock.millis();
    }

    /**
     * Registers a freshly opened connection.
     *
     * @param classroomCode code from the connection URL, or null
     * @return false if the code was invalid; the client has been told and the socket will close
     *         after the grace delay
     */
    public boolean onOpen(ClientConnection connection, String classroomCode) {
        String code = classroomCode == null || classroomCode.isBlank() ? null : classroomCode.trim();
        registry.add(connection, connection.id(), code);
        if (code != null && !directory.isValidCode(code)) {
            LOG.warn("Connection {} opened with invalid classroom code {}", connection.id(), code);
            try {
                connection.send(ErrorMessage.invalidClassroom());
            } catch (RuntimeException e) {
                LOG.warn("Could not send invalid classroom error to {}: {}", connection.id(), e.getMessage());
            }
            closer.closeInvalidClassroom(connection);
            return false;
        }
        LOG.info("Connection {} opened{} ({} open)", connection.id(),
                code == null ? "" : " with classroom code " + code, registry.size());
        return true;
    }

    /**
     * Forgets a closed connection and updates session presence.
     */
    public void onClose(ClientConnection connection, int statusCode) {
        Optional<ConnectionState> removed = registry.remove(connection);
        if (removed.isEmpty()) {
            return;
        }
        ConnectionState state = removed.get();
        String sessionId = state.sessionId();
        LOG.info("Connection {} closed with status {} (role {}, session {})", connection.id(), statusCode,
                state.role() == null ? "unregistered" : state.role().wireName(), sessionId);

        if (state.isListener() && state.listenerCounted()
                && !registry.hasOtherConnectionsWithSessionId(sessionId, connection, Role.LISTENER)) {
            lifecycle.markAllListenersLeft(sessionId);
        }
        if (state.isPresenter()
                && !registry.hasOtherConnectionsWithSessionId(sessionId, connection, Role.PRESENTER)) {
            directory.markPresenterDisconnected(sessionId);
        }
    }
}
