package com.phillippitts.livetranslate.protocol.inbound;

import com.phillippitts.livetranslate.protocol.MessageType;

/**
 * A decoded client frame. One record per {@link MessageType}.
 */
public interface InboundMessage {

    MessageType type();
}
