package com.phillippitts.livetranslate.protocol.inbound;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.protocol.MessageType;

/** Partial settings update merged into the connection's current settings. */
public record SettingsMessage(ClientSettings settings) implements InboundMessage {

    @Override
    public MessageType type() {
        return MessageType.SETTINGS;
    }
}
