package com.phillippitts.livetranslate.presentation.websocket;

import com.phillippitts.livetranslate.exception.DeliveryException;
import com.phillippitts.livetranslate.protocol.MessageCodec;
import com.phillippitts.livetranslate.protocol.outbound.OutboundMessage;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link ClientConnection} over a Spring {@link WebSocketSession}.
 *
 * <p>Writes go through a {@link ConcurrentWebSocketSessionDecorator}, which serializes sends
 * from the delivery pool onto the socket and bounds how long and how much a slow client may
 * buffer.
 */
class WebSocketClientConnection implements ClientConnection {

    private static final Logger LOG = LogManager.getLogger(WebSocketClientConnection.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 4 * 1024 * 1024;

    private final String id;
    private final WebSocketSession session;

    WebSocketClientConnection(String id, WebSocketSession session) {
        this.id = Objects.requireNonNull(id, "id");
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(OutboundMessage message) {
        if (!session.isOpen()) {
            throw new DeliveryException(id, "socket is closed");
        }
        try {
            session.sendMessage(new TextMessage(MessageCodec.encode(message)));
        } catch (IOException e) {
            throw new DeliveryException(id, e.getMessage(), e);
        } catch (RuntimeException e) {
            // SessionLimitExceededException and IllegalStateException from a closing socket
            throw new DeliveryException(id, e.getMessage(), e);
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            LOG.warn("Error closing connection {}: {}", id, e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
