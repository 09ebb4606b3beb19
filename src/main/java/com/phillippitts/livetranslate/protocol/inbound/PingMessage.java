package com.phillippitts.livetranslate.protocol.inbound;

import com.phillippitts.livetranslate.protocol.MessageType;

/** Client round-trip probe; {@code timestamp} is echoed back when present. */
public record PingMessage(Long timestamp) implements InboundMessage {

    @Override
    public MessageType type() {
        return MessageType.PING;
    }
}
