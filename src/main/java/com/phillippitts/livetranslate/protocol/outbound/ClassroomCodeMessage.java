package com.phillippitts.livetranslate.protocol.outbound;

import org.json.JSONObject;

/** Tells a presenter which code listeners join with, and until when (epoch millis). */
public record ClassroomCodeMessage(String code, String sessionId, long expiresAt) implements OutboundMessage {

    @Override
    public String type() {
        return "classroom_code";
    }

    @Override
    public JSONObject toJson() {
        return new JSONObject()
                .put("type", type())
                .put("code", code)
                .put("sessionId", sessionId)
                .put("expiresAt", expiresAt);
    }
}
