package com.phillippitts.livetranslate.service.dispatch.handler;

import com.phillippitts.livetranslate.protocol.MessageType;
import com.phillippitts.livetranslate.protocol.inbound.PingMessage;
import com.phillippitts.livetranslate.protocol.outbound.PongReply;
import com.phillippitts.livetranslate.service.dispatch.HandlerContext;
import com.phillippitts.livetranslate.service.dispatch.MessageHandler;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class PingHandler implements MessageHandler<PingMessage> {

    private final Clock clock;

    public PingHandler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public MessageType type() {
        return MessageType.PING;
    }

    @Override
    public Class<PingMessage> messageClass() {
        return PingMessage.class;
    }

    @Override
    public void handle(PingMessage message, HandlerContext context) {
        context.reply(new PongReply(clock.millis(), message.timestamp()));
    }
}
