package com.phillippitts.livetranslate.service.dispatch.handler;

import com.phillippitts.livetranslate.protocol.MessageType;
import com.phillippitts.livetranslate.protocol.inbound.TtsRequestMessage;
import com.phillippitts.livetranslate.protocol.outbound.TtsResponseMessage;
import com.phillippitts.livetranslate.service.dispatch.HandlerContext;
import com.phillippitts.livetranslate.service.dispatch.MessageHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/** Answers explicit speech requests with audio, client speech parameters or a TTS error. */
@Component
public class TtsRequestHandler implements MessageHandler<TtsRequestMessage> {

    private static final Logger LOG = LogManager.getLogger(TtsRequestHandler.class);

    @Override
    public MessageType type() {
        return MessageType.TTS_REQUEST;
    }

    @Override
    public Class<TtsRequestMessage> messageClass() {
        return TtsRequestMessage.class;
    }

    @Override
    public void handle(TtsRequestMessage message, HandlerContext context) {
        TtsResponseMessage response = context.fanout().synthesizeOnDemand(message.text(), message.languageCode(),
                message.voice(), context.registry().getSettings(context.connection()));
        if (!response.success()) {
            LOG.warn("TTS request from {} failed: {}", context.connection().id(), response.errorMessage());
        }
        context.reply(response);
    }
}
