package com.phillippitts.livetranslate.protocol.outbound;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.Role;
import com.phillippitts.livetranslate.protocol.ProtocolJson;
import org.json.JSONObject;

/** Echoes the registered role, language and settings. */
public record RegisterAck(Role role, String languageCode, ClientSettings settings) implements OutboundMessage {

    @Override
    public String type() {
        return "register";
    }

    @Override
    public JSONObject toJson() {
        JSONObject data = new JSONObject()
                .put("role", role.wireName())
                .put("languageCode", languageCode)
                .put("settings", ProtocolJson.settings(settings));
        return new JSONObject()
                .put("type", type())
                .put("status", "success")
                .put("data", data);
    }
}
