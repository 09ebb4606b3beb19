package com.phillippitts.livetranslate.protocol.inbound;

import com.phillippitts.livetranslate.protocol.MessageType;

/** Client answer to a server heartbeat. */
public record PongMessage() implements InboundMessage {

    @Override
    public MessageType type() {
        return MessageType.PONG;
    }
}
