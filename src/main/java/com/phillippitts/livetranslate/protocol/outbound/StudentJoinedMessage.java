package com.phillippitts.livetranslate.protocol.outbound;

import org.json.JSONObject;

/** Notifies presenters of a listener joining their session. */
public record StudentJoinedMessage(String studentId, String name, String languageCode) implements OutboundMessage {

    @Override
    public String type() {
        return "student_joined";
    }

    @Override
    public JSONObject toJson() {
        JSONObject payload = new JSONObject()
                .put("studentId", studentId)
                .put("name", name)
                .put("languageCode", languageCode);
        return new JSONObject()
                .put("type", type())
                .put("payload", payload);
    }
}
