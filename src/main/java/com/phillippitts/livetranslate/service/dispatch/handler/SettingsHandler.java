package com.phillippitts.livetranslate.service.dispatch.handler;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.protocol.MessageType;
import com.phillippitts.livetranslate.protocol.inbound.SettingsMessage;
import com.phillippitts.livetranslate.protocol.outbound.SettingsAck;
import com.phillippitts.livetranslate.service.dispatch.HandlerContext;
import com.phillippitts.livetranslate.service.dispatch.MessageHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/** Merges delivery preferences into the connection's settings and echoes the result. */
@Component
public class SettingsHandler implements MessageHandler<SettingsMessage> {

    private static final Logger LOG = LogManager.getLogger(SettingsHandler.class);

    @Override
    public MessageType type() {
        return MessageType.SETTINGS;
    }

    @Override
    public Class<SettingsMessage> messageClass() {
        return SettingsMessage.class;
    }

    @Override
    public void handle(SettingsMessage message, HandlerContext context) {
        ClientSettings merged = context.registry().updateSettings(context.connection(), message.settings());
        LOG.debug("Connection {} settings now {} (mode {})", context.connection().id(), merged, merged.deliveryMode());
        context.reply(new SettingsAck(merged));
    }
}
