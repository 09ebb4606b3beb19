package com.phillippitts.livetranslate.service.dispatch.handler;

import com.phillippitts.livetranslate.protocol.MessageType;
import com.phillippitts.livetranslate.protocol.inbound.PongMessage;
import com.phillippitts.livetranslate.service.dispatch.HandlerContext;
import com.phillippitts.livetranslate.service.dispatch.MessageHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/** Client keep-alive answer; acknowledged silently. */
@Component
public class PongHandler implements MessageHandler<PongMessage> {

    private static final Logger LOG = LogManager.getLogger(PongHandler.class);

    @Override
    public MessageType type() {
        return MessageType.PONG;
    }

    @Override
    public Class<PongMessage> messageClass() {
        return PongMessage.class;
    }

    @Override
    public void handle(PongMessage message, HandlerContext context) {
        LOG.trace("Pong from {}", context.connection().id());
    }
}
