package com.phillippitts.livetranslate.presentation.websocket;

import com.phillippitts.livetranslate.config.logging.MdcKeys;
import com.phillippitts.livetranslate.service.dispatch.ConnectionLifecycle;
import com.phillippitts.livetranslate.service.dispatch.MessageRouter;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import com.phillippitts.livetranslate.service.registry.ConnectionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * WebSocket entry point for presenters and listeners.
 *
 * <p>Clients connect with {@code ws://host:port/ws}, listeners typically with
 * {@code ?class=<code>} from a shared link. Every frame is handed to the {@link MessageRouter}
 * with {@code connectionId} and {@code sessionId} in the ThreadContext.
 */
@Component
public class ClassroomWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(ClassroomWebSocketHandler.class);

    static final String CONNECTION_ATTRIBUTE = "liveTranslateConnection";

    private final ConnectionLifecycle connectionLifecycle;
    private final MessageRouter router;
    private final ConnectionRegistry registry;

    public ClassroomWebSocketHandler(ConnectionLifecycle connectionLifecycle, MessageRouter router,
                                     ConnectionRegistry registry) {
        this.connectionLifecycle = connectionLifecycle;
        this.router = router;
        this.registry = registry;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ClientConnection connection = new WebSocketClientConnection(connectionLifecycle.nextConnectionId(), session);
        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
        ThreadContext.put(MdcKeys.CONNECTION_ID, connection.id());
        try {
            connectionLifecycle.onOpen(connection, classroomCodeOf(session.getUri()));
        } finally {
            ThreadContext.remove(MdcKeys.CONNECTION_ID);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection connection = connectionOf(session);
        if (connection == null) {
            LOG.warn("Frame on unknown WebSocket session {}", session.getId());
            return;
        }
        ThreadContext.put(MdcKeys.CONNECTION_ID, connection.id());
        String sessionId = registry.getSessionId(connection);
        if (sessionId != null) {
            ThreadContext.put(MdcKeys.SESSION_ID, sessionId);
        }
        try {
            router.route(connection, message.getPayload());
        } finally {
            ThreadContext.remove(MdcKeys.CONNECTION_ID);
            ThreadContext.remove(MdcKeys.SESSION_ID);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ClientConnection connection = connectionOf(session);
        LOG.warn("Transport error on {}: {}", connection == null ? session.getId() : connection.id(),
                exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        ThreadContext.put(MdcKeys.CONNECTION_ID, connection.id());
        try {
            connectionLifecycle.onClose(connection, status.getCode());
        } finally {
            ThreadContext.remove(MdcKeys.CONNECTION_ID);
        }
    }

    private static ClientConnection connectionOf(WebSocketSession session) {
        Object value = session.getAttributes().get(CONNECTION_ATTRIBUTE);
        return value instanceof ClientConnection c ? c : null;
    }

    /** Classroom code from the {@code class} or {@code code} query parameter, or null. */
    static String classroomCodeOf(URI uri) {
        if (uri == null) {
            return null;
        }
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        String code = params.getFirst("class");
        if (code == null || code.isBlank()) {
            code = params.getFirst("code");
        }
        return code == null || code.isBlank() ? null : code;
    }
}
