package com.phillippitts.livetranslate.protocol.outbound;

import com.phillippitts.livetranslate.domain.SpeechParams;
import com.phillippitts.livetranslate.protocol.ErrorCode;
import com.phillippitts.livetranslate.protocol.ProtocolJson;
import org.json.JSONObject;

/**
 * Answer to a {@code tts_request}: audio, client speech parameters, or an error.
 */
public record TtsResponseMessage(
        boolean success,
        String text,
        String languageCode,
        String ttsServiceType,
        String audioData,
        SpeechParams speechParams,
        String errorMessage,
        long timestamp
) implements OutboundMessage {

    public static TtsResponseMessage audio(String text, String languageCode, String ttsServiceType,
                                           String audioData, long timestamp) {
        return new TtsResponseMessage(true, text, languageCode, ttsServiceType, audioData, null, null, timestamp);
    }

    public static TtsResponseMessage clientSpeech(String text, String languageCode, String ttsServiceType,
                                                  SpeechParams params, long timestamp) {
        return new TtsResponseMessage(true, text, languageCode, ttsServiceType, null, params, null, timestamp);
    }

    public static TtsResponseMessage error(String text, String languageCode, String ttsServiceType,
                                           String errorMessage, long timestamp) {
        return new TtsResponseMessage(false, text, languageCode, ttsServiceType, null, null, errorMessage, timestamp);
    }

    @Override
    public String type() {
        return "tts_response";
    }

    @Override
    public JSONObject toJson() {
        JSONObject json = new JSONObject()
                .put("type", type())
                .put("status", success ? "success" : "error")
                .put("text", text == null ? "" : text)
                .put("languageCode", languageCode == null ? "" : languageCode)
                .put("ttsServiceType", ttsServiceType)
                .put("timestamp", timestamp);
        if (!success) {
            json.put("error", new JSONObject()
                    .put("message", errorMessage)
                    .put("code", ErrorCode.TTS_ERROR.name()));
        } else if (speechParams != null) {
            json.put("useClientSpeech", true);
            json.put("speechParams", ProtocolJson.speechParams(speechParams));
        } else {
            json.put("audioData", audioData == null ? "" : audioData);
        }
        return json;
    }
}
