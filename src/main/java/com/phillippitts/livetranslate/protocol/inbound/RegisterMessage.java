package com.phillippitts.livetranslate.protocol.inbound;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.Role;
import com.phillippitts.livetranslate.protocol.MessageType;

/**
 * Declares the connection's role and language.
 *
 * @param classroomCode code a listener joins with (may also arrive on the connection URL)
 * @param presenterId   stable presenter identity used to reclaim a session after reconnect
 */
public record RegisterMessage(Role role, String languageCode, String name, String classroomCode,
                              ClientSettings settings, String presenterId) implements InboundMessage {

    public RegisterMessage {
        settings = settings == null ? ClientSettings.empty() : settings;
    }

    @Override
    public MessageType type() {
        return MessageType.REGISTER;
    }
}
