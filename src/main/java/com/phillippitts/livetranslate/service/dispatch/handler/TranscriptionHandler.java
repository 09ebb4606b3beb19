package com.phillippitts.livetranslate.service.dispatch.handler;

import com.phillippitts.livetranslate.config.properties.DeliveryProperties;
import com.phillippitts.livetranslate.domain.LatencyTrace;
import com.phillippitts.livetranslate.domain.Role;
import com.phillippitts.livetranslate.exception.InvalidMessageException;
import com.phillippitts.livetranslate.protocol.MessageType;
import com.phillippitts.livetranslate.protocol.inbound.TranscriptionMessage;
import com.phillippitts.livetranslate.service.dispatch.HandlerContext;
import com.phillippitts.livetranslate.service.dispatch.MessageHandler;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import com.phillippitts.livetranslate.service.registry.ConnectionRegistry;
import com.phillippitts.livetranslate.service.registry.ListenerSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Broadcasts a presenter's transcription to every listener of its session.
 * Transcriptions from non-presenters are ignored.
 */
@Component
public class TranscriptionHandler implements MessageHandler<TranscriptionMessage> {

    private static final Logger LOG = LogManager.getLogger(TranscriptionHandler.class);

    private final DeliveryProperties props;

    public TranscriptionHandler(DeliveryProperties props) {
        this.props = props;
    }

    @Override
    public MessageType type() {
        return MessageType.TRANSCRIPTION;
    }

    @Override
    public Class<TranscriptionMessage> messageClass() {
        return TranscriptionMessage.class;
    }

    @Override
    public void handle(TranscriptionMessage message, HandlerContext context) {
        ConnectionRegistry registry = context.registry();
        ClientConnection connection = context.connection();
        if (registry.getRole(connection) != Role.PRESENTER) {
            LOG.warn("Ignoring transcription from non-presenter {}", connection.id());
            return;
        }
        String language = registry.getLanguage(connection);
        if (language == null) {
            language = props.getDefaultPresenterLanguage();
        }
        if (!context.fanout().validateRequest(message.text(), language)) {
            throw new InvalidMessageException(MessageType.TRANSCRIPTION.wireName(), "text must not be empty");
        }

        String sessionId = registry.getSessionId(connection);
        ListenerSnapshot listeners = registry.getListenersForSession(sessionId);
        LatencyTrace trace = new LatencyTrace(context.receivedAtNanos(), 0, 0, 0);
        context.fanout().broadcast(sessionId, message.text(), language, listeners, registry::getSettings, trace);
    }
}
