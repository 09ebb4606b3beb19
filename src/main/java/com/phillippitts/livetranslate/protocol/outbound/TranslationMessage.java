package com.phillippitts.livetranslate.protocol.outbound;

import com.phillippitts.livetranslate.domain.LatencyTrace;
import com.phillippitts.livetranslate.domain.SpeechParams;
import com.phillippitts.livetranslate.protocol.ProtocolJson;
import org.json.JSONObject;

/**
 * One listener's translated text with its rendering payload.
 *
 * @param audioData       base64 audio, empty when synthesis was skipped or failed
 * @param speechParams    present only when {@code useClientSpeech} is true
 */
public record TranslationMessage(
        String text,
        String originalText,
        String sourceLanguage,
        String targetLanguage,
        String ttsServiceType,
        LatencyTrace.Breakdown latency,
        String audioData,
        boolean useClientSpeech,
        SpeechParams speechParams
) implements OutboundMessage {

    @Override
    public String type() {
        return "translation";
    }

    @Override
    public JSONObject toJson() {
        JSONObject json = new JSONObject()
                .put("type", type())
                .put("text", text)
                .put("originalText", originalText)
                .put("sourceLanguage", sourceLanguage)
                .put("targetLanguage", targetLanguage)
                .put("ttsServiceType", ttsServiceType)
                .put("latency", ProtocolJson.latency(latency))
                .put("audioData", audioData == null ? "" : audioData)
                .put("useClientSpeech", useClientSpeech);
        if (speechParams != null) {
            json.put("speechParams", ProtocolJson.speechParams(speechParams));
        }
        return json;
    }
}
