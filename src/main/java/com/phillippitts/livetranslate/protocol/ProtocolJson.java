package com.phillippitts.livetranslate.protocol;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.LatencyTrace;
import com.phillippitts.livetranslate.domain.SpeechParams;
import org.json.JSONObject;

/**
 * JSON shapes shared by several message types.
 */
public final class ProtocolJson {

    private ProtocolJson() {
    }

    public static JSONObject settings(ClientSettings settings) {
        JSONObject json = new JSONObject();
        if (settings == null) {
            return json;
        }
        if (settings.ttsServiceType() != null) {
            json.put("ttsServiceType", settings.ttsServiceType());
        }
        if (settings.useClientSpeech() != null) {
            json.put("useClientSpeech", settings.useClientSpeech().booleanValue());
        }
        return json;
    }

    public static ClientSettings settings(JSONObject json) {
        if (json == null) {
            return ClientSettings.empty();
        }
        String tts = json.has("ttsServiceType") && !json.isNull("ttsServiceType")
                ? json.get("ttsServiceType").toString() : null;
        Boolean clientSpeech = json.has("useClientSpeech") && !json.isNull("useClientSpeech")
                ? json.optBoolean("useClientSpeech") : null;
        return new ClientSettings(tts, clientSpeech);
    }

    public static JSONObject speechParams(SpeechParams params) {
        return new JSONObject()
                .put("type", params.type())
                .put("text", params.text())
                .put("languageCode", params.languageCode())
                .put("autoPlay", params.autoPlay());
    }

    public static JSONObject latency(LatencyTrace.Breakdown latency) {
        JSONObject components = new JSONObject()
                .put("preparation", latency.preparationMs())
                .put("translation", latency.translationMs())
                .put("tts", latency.synthesisMs())
                .put("processing", latency.processingMs());
        return new JSONObject()
                .put("total", latency.totalMs())
                .put("serverCompleteTime", latency.serverCompleteTime())
                .put("components", components);
    }
}
