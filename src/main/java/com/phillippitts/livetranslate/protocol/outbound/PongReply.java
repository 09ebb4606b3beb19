package com.phillippitts.livetranslate.protocol.outbound;

import org.json.JSONObject;

/** Answer to a ping. */
public record PongReply(long timestamp, Long originalTimestamp) implements OutboundMessage {

    @Override
    public String type() {
        return "pong";
    }

    @Override
    public JSONObject toJson() {
        JSONObject json = new JSONObject()
                .put("type", type())
                .put("timestamp", timestamp);
        if (originalTimestamp != null) {
            json.put("originalTimestamp", originalTimestamp.longValue());
        }
        return json;
    }
}
