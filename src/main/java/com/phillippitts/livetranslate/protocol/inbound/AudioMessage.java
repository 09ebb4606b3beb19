package com.phillippitts.livetranslate.protocol.inbound;

import com.phillippitts.livetranslate.protocol.MessageType;

/** Base64 audio chunk streamed by a presenter. */
public record AudioMessage(String data) implements InboundMessage {

    @Override
    public MessageType type() {
        return MessageType.AUDIO;
    }
}
