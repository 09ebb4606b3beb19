package com.phillippitts.livetranslate.service.translation;

import com.phillippitts.livetranslate.config.properties.ProviderProperties;
import com.phillippitts.livetranslate.exception.ProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Translation through the public MyMemory HTTP API ({@code GET /get?q=..&langpair=src|tgt}).
 *
 * <p>No API key is needed for low volumes. The service answers HTTP 200 even for logical
 * failures, so the {@code responseStatus} field of the body is checked as well.
 */
@Component
@ConditionalOnProperty(name = "live-translate.provider.translation", havingValue = "mymemory")
public class MyMemoryTranslationProvider implements TranslationProvider {

    private static final Logger LOG = LogManager.getLogger(MyMemoryTranslationProvider.class);

    public static final String NAME = "mymemory";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public MyMemoryTranslationProvider(RestTemplateBuilder builder, ProviderProperties props) {
        this(builder
                        .setConnectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                        .setReadTimeout(Duration.ofMillis(props.getReadTimeoutMs()))
                        .build(),
                props.getMymemoryBaseUrl());
    }

    MyMemoryTranslationProvider(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    }

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/get")
                .queryParam("q", text)
                .queryParam("langpair", LanguageCodes.baseLanguage(sourceLanguage) + "|"
                        + LanguageCodes.baseLanguage(targetLanguage))
                .encode()
                .build()
                .toUri();
        String body;
        try {
            body = restTemplate.getForObject(uri, String.class);
        } catch (RestClientException e) {
            throw new ProviderException("MyMemory request failed: " + e.getMessage(), NAME, e);
        }
        return parse(body, targetLanguage);
    }

    String parse(String body, String targetLanguage) {
        if (body == null || body.isBlank()) {
            throw new ProviderException("MyMemory returned an empty body", NAME);
        }
        try {
            JSONObject json = new JSONObject(body);
            int status = json.optInt("responseStatus", 200);
            if (status != 200) {
                throw new ProviderException("MyMemory status " + status + ": "
                        + json.optString("responseDetails", ""), NAME);
            }
            JSONObject data = json.optJSONObject("responseData");
            String translated = data == null ? null : data.optString("translatedText", null);
            if (translated == null || translated.isBlank()) {
                throw new ProviderException("MyMemory returned no translation for " + targetLanguage, NAME);
            }
            LOG.debug("MyMemory translated {} chars to {}", translated.length(), targetLanguage);
            return translated;
        } catch (JSONException e) {
            throw new ProviderException("MyMemory returned malformed JSON", NAME, e);
        }
    }

    @Override
    public String getProviderName() {
        return NAME;
    }
}
