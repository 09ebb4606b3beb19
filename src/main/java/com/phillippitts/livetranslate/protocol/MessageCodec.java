package com.phillippitts.livetranslate.protocol;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.Role;
import com.phillippitts.livetranslate.exception.InvalidMessageException;
import com.phillippitts.livetranslate.protocol.inbound.AudioMessage;
import com.phillippitts.livetranslate.protocol.inbound.InboundMessage;
import com.phillippitts.livetranslate.protocol.inbound.PingMessage;
import com.phillippitts.livetranslate.protocol.inbound.PongMessage;
import com.phillippitts.livetranslate.protocol.inbound.RegisterMessage;
import com.phillippitts.livetranslate.protocol.inbound.SettingsMessage;
import com.phillippitts.livetranslate.protocol.inbound.TranscriptionMessage;
import com.phillippitts.livetranslate.protocol.inbound.TtsRequestMessage;
import com.phillippitts.livetranslate.protocol.outbound.OutboundMessage;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Decodes inbound text frames into typed messages and encodes outbound ones.
 *
 * <p>Decoding validates structure only: the {@code type} discriminant, required fields and
 * their JSON types. Content rules that need a reply of their own (an empty {@code tts_request}
 * text answered with {@code TTS_ERROR}) are left to handlers.
 *
 * <p><b>Security:</b> frames above {@link #MAX_FRAME_SIZE} are rejected before parsing.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
public final class MessageCodec {

    /**
     * Largest accepted inbound frame (audio chunks included). The WebSocket container buffer is
     * sized to match, and Tomcat allocates that buffer per connection.
     */
    public static final int MAX_FRAME_SIZE = 1_048_576;

    private MessageCodec() {
    }

    /**
     * Parses one inbound frame.
     *
     * @param raw frame payload
     * @return typed message
     * @throws InvalidMessageException on malformed JSON, unknown type or missing fields
     */
    public static InboundMessage decode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidMessageException("empty frame");
        }
        if (raw.length() > MAX_FRAME_SIZE) {
            throw new InvalidMessageException("frame exceeds " + MAX_FRAME_SIZE + " characters");
        }
        JSONObject json;
        try {
            json = new JSONObject(raw);
        } catch (JSONException e) {
            throw new InvalidMessageException("malformed JSON");
        }
        String typeName = json.optString("type", null);
        if (typeName == null || typeName.isBlank()) {
            throw new InvalidMessageException("missing type");
        }
        MessageType type = MessageType.fromWire(typeName)
                .orElseThrow(() -> new InvalidMessageException(typeName, "unsupported message type"));

        try {
            switch (type) {
                case REGISTER:
                    return decodeRegister(json);
                case TRANSCRIPTION:
                    return new TranscriptionMessage(requireString(json, type, "text"));
                case TTS_REQUEST:
                    return new TtsRequestMessage(
                            optString(json, "text"), optString(json, "languageCode"), optString(json, "voice"));
                case AUDIO:
                    return new AudioMessage(requireString(json, type, "data"));
                case SETTINGS:
                    return decodeSettings(json);
                case PING:
                    return new PingMessage(json.has("timestamp") ? json.optLong("timestamp") : null);
                case PONG:
                    return new PongMessage();
                default:
                    throw new InvalidMessageException(typeName, "unsupported message type");
            }
        } catch (JSONException e) {
            throw new InvalidMessageException(typeName, e.getMessage(), e);
        }
    }

    /**
     * Serializes an outbound message.
     */
    public static String encode(OutboundMessage message) {
        return message.toJson().toString();
    }

    private static RegisterMessage decodeRegister(JSONObject json) {
        Role role = Role.fromWire(optString(json, "role"));
        ClientSettings settings = json.has("settings")
                ? ProtocolJson.settings(json.optJSONObject("settings"))
                : ClientSettings.empty();
        String presenterId = optString(json, "presenterId");
        if (presenterId == null) {
            presenterId = optString(json, "teacherId");
        }
        return new RegisterMessage(role,
                optString(json, "languageCode"),
                optString(json, "name"),
                optString(json, "classroomCode"),
                settings,
                presenterId);
    }

    private static SettingsMessage decodeSettings(JSONObject json) {
        JSONObject nested = json.optJSONObject("settings");
        ClientSettings settings = ProtocolJson.settings(nested != null ? nested : json);
        return new SettingsMessage(settings);
    }

    private static String requireString(JSONObject json, MessageType type, String field) {
        Object value = json.opt(field);
        if (!(value instanceof String s)) {
            throw new InvalidMessageException(type.wireName(), field + " must be a string");
        }
        return s;
    }

    private static String optString(JSONObject json, String field) {
        Object value = json.opt(field);
        return value instanceof String s ? s : null;
    }
}
