package com.phillippitts.livetranslate.service.dispatch;

import com.phillippitts.livetranslate.exception.DeliveryException;
import com.phillippitts.livetranslate.protocol.outbound.OutboundMessage;
import com.phillippitts.livetranslate.service.classroom.ClassroomSessionDirectory;
import com.phillippitts.livetranslate.service.delivery.TranslationFanoutService;
import com.phillippitts.livetranslate.service.lifecycle.SessionLifecycleService;
import com.phillippitts.livetranslate.service.persistence.SessionRepository;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import com.phillippitts.livetranslate.service.registry.ConnectionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Per-message view handed to a {@link MessageHandler}: the sending connection plus the shared
 * collaborators, which are the same singleton instances for every message.
 */
public final class HandlerContext {

    private static final Logger LOG = LogManager.getLogger(HandlerContext.class);

    private final ClientConnection connection;
    private final long receivedAtNanos;
    private final ConnectionRegistry registry;
    private final ClassroomSessionDirectory directory;
    private final SessionRepository repository;
    private final TranslationFanoutService fanout;
    private final SessionLifecycleService lifecycle;
    private final ConnectionCloser closer;

    HandlerContext(ClientConnection connection, long receivedAtNanos, ConnectionRegistry registry,
                   ClassroomSessionDirectory directory, SessionRepository repository,
                   TranslationFanoutService fanout, SessionLifecycleService lifecycle, ConnectionCloser closer) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.receivedAtNanos = receivedAtNanos;
        this.registry = registry;
        this.directory = directory;
        this.repository = repository;
        this.fanout = fanout;
        this.lifecycle = lifecycle;
        this.closer = closer;
    }

    public ClientConnection connection() {
        return connection;
    }

    /** {@link System#nanoTime()} when the frame arrived; start of the latency trace. */
    public long receivedAtNanos() {
        return receivedAtNanos;
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public ClassroomSessionDirectory directory() {
        return directory;
    }

    public SessionRepository repository() {
        return repository;
    }

    public TranslationFanoutService fanout() {
        return fanout;
    }

    public SessionLifecycleService lifecycle() {
        return lifecycle;
    }

    public ConnectionCloser closer() {
        return closer;
    }

    /** Sends to the originating connection; failures are logged, not thrown. */
    public boolean reply(OutboundMessage message) {
        return sendTo(connection, message);
    }

    /** Single-attempt send to any connection; failures are logged, not thrown. */
    public boolean sendTo(ClientConnection target, OutboundMessage message) {
        try {
            target.send(message);
            return true;
        } catch (DeliveryException e) {
            LOG.warn("Could not send {} to {}: {}", message.type(), target.id(), e.getMessage());
            return false;
        }
    }
}
