package com.phillippitts.livetranslate.service.dispatch;

import com.phillippitts.livetranslate.exception.InvalidMessageException;
import com.phillippitts.livetranslate.exception.InvalidSessionException;
import com.phillippitts.livetranslate.protocol.MessageCodec;
import com.phillippitts.livetranslate.protocol.MessageType;
import com.phillippitts.livetranslate.protocol.inbound.InboundMessage;
import com.phillippitts.livetranslate.protocol.outbound.ErrorMessage;
import com.phillippitts.livetranslate.service.classroom.ClassroomSessionDirectory;
import com.phillippitts.livetranslate.service.delivery.TranslationFanoutService;
import com.phillippitts.livetranslate.service.lifecycle.SessionLifecycleService;
import com.phillippitts.livetranslate.service.persistence.SessionRepository;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import com.phillippitts.livetranslate.service.registry.ConnectionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes inbound frames and dispatches them to the handler registered for their type.
 *
 * <p>The router holds no business logic. It owns three cross-cutting rules:
 * <ul>
 *   <li>Malformed frames are answered with {@code error{code:"INVALID_MESSAGE"}}</li>
 *   <li>A connection whose classroom code has expired may only send register, ping and pong;
 *       anything else is answered with {@code session_expired}</li>
 *   <li>{@link InvalidSessionException} from a handler is answered with
 *       {@code INVALID_CLASSROOM} and the connection is closed after the grace delay</li>
 * </ul>
 */
@Component
public class MessageRouter {

    private static final Logger LOG = LogManager.getLogger(MessageRouter.class);

    private final Map<MessageType, MessageHandler<? extends InboundMessage>> handlers =
            new EnumMap<>(MessageType.class);

    private final ConnectionRegistry registry;
    private final ClassroomSessionDirectory directory;
    private final SessionRepository repository;
    private final TranslationFanoutService fanout;
    private final SessionLifecycleService lifecycle;
    private final ConnectionCloser closer;

    public MessageRouter(List<MessageHandler<? extends InboundMessage>> handlerBeans,
                         ConnectionRegistry registry,
                         ClassroomSessionDirectory directory,
                         SessionRepository repository,
                         TranslationFanoutService fanout,
                         SessionLifecycleService lifecycle,
                         ConnectionCloser closer) {
        for (MessageHandler<? extends InboundMessage> handler : handlerBeans) {
            MessageHandler<? extends InboundMessage> previous = handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for message type " + handler.type());
            }
        }
        this.registry = registry;
        this.directory = directory;
        this.repository = repository;
        this.fanout = fanout;
        this.lifecycle = lifecycle;
        this.closer = closer;
        LOG.info("Message router ready with handlers for {}", handlers.keySet());
    }

    /**
     * Routes one raw frame from {@code connection}. Never throws.
     */
    public void route(ClientConnection connection, String rawFrame) {
        HandlerContext context = contextFor(connection);
        InboundMessage message;
        try {
            message = MessageCodec.decode(rawFrame);
        } catch (InvalidMessageException e) {
            LOG.warn("Rejected frame from {}: {}", connection.id(), e.getMessage());
            context.reply(ErrorMessage.invalidMessage(e.getMessage()));
            return;
        }
        dispatch(message, context);
    }

    /**
     * Dispatches an already decoded message. Never throws.
     */
    public void dispatch(InboundMessage message, HandlerContext context) {
        ClientConnection connection = context.connection();
        if (!message.type().allowedAfterExpiry() && hasExpiredClassroom(connection)) {
            LOG.info("Connection {} sent {} after its classroom code expired", connection.id(),
                    message.type().wireName());
            context.reply(ErrorMessage.sessionExpired());
            return;
        }
        MessageHandler<? extends InboundMessage> handler = handlers.get(message.type());
        if (handler == null) {
            LOG.warn("No handler for message type {}", message.type());
            context.reply(ErrorMessage.invalidMessage("Unsupported message type: " + message.type().wireName()));
            return;
        }
        try {
            invoke(handler, message, context);
        } catch (InvalidMessageException e) {
            LOG.warn("Invalid {} from {}: {}", message.type().wireName(), connection.id(), e.getMessage());
            context.reply(ErrorMessage.invalidMessage(e.getMessage()));
        } catch (InvalidSessionException e) {
            LOG.warn("Connection {} used invalid classroom code {}", connection.id(), e.getIdentifier());
            context.reply(ErrorMessage.invalidClassroom());
            closer.closeInvalidClassroom(connection);
        } catch (RuntimeException e) {
            LOG.error("Handler for {} failed on connection {}", message.type().wireName(), connection.id(), e);
        }
    }

    /** Builds the per-message context; visible for handler tests. */
    public HandlerContext contextFor(ClientConnection connection) {
        return new HandlerContext(connection, System.nanoTime(), registry, directory, repository, fanout,
                lifecycle, closer);
    }

    private static <M extends InboundMessage> void invoke(MessageHandler<M> handler, InboundMessage message,
                                                          HandlerContext context) {
        handler.handle(handler.messageClass().cast(message), context);
    }

    private boolean hasExpiredClassroom(ClientConnection connection) {
        String code = registry.getClassroomCode(connection);
        return code != null && !directory.isValidCode(code);
    }
}
