package com.phillippitts.livetranslate.protocol.outbound;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.protocol.ProtocolJson;
import org.json.JSONObject;

/** Confirms a settings update with the merged result. */
public record SettingsAck(ClientSettings settings) implements OutboundMessage {

    @Override
    public String type() {
        return "settings";
    }

    @Override
    public JSONObject toJson() {
        return new JSONObject()
                .put("type", type())
                .put("status", "success")
                .put("settings", ProtocolJson.settings(settings));
    }
}
