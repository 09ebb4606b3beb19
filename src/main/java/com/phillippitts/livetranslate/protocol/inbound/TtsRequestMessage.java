package com.phillippitts.livetranslate.protocol.inbound;

import com.phillippitts.livetranslate.protocol.MessageType;

/** On-demand synthesis of a text, for replaying a translation. */
public record TtsRequestMessage(String text, String languageCode, String voice) implements InboundMessage {

    @Override
    public MessageType type() {
        return MessageType.TTS_REQUEST;
    }
}
