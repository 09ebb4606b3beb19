package com.phillippitts.livetranslate.protocol.inbound;

import com.phillippitts.livetranslate.protocol.MessageType;

/** Presenter speech recognized as text; the broadcast source. */
public record TranscriptionMessage(String text) implements InboundMessage {

    @Override
    public MessageType type() {
        return MessageType.TRANSCRIPTION;
    }
}
