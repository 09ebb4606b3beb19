package com.phillippitts.livetranslate.protocol.outbound;

import org.json.JSONObject;

/**
 * A server frame. Each record renders its own JSON shape.
 */
public interface OutboundMessage {

    String type();

    JSONObject toJson();
}
