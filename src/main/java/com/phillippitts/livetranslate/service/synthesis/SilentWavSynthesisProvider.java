package com.phillippitts.livetranslate.service.synthesis;

import com.phillippitts.livetranslate.exception.ProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Stand-in synthesis engine that renders silence of a plausible spoken length.
 *
 * <p>Duration is {@value #MILLIS_PER_CHARACTER} ms per character, clamped to
 * [{@value #MIN_DURATION_MS}, {@value #MAX_DURATION_MS}] ms, so clients exercise the full audio
 * path without a real engine configured.
 */
@Component
@ConditionalOnProperty(name = "live-translate.provider.synthesis", havingValue = "silent-wav",
        matchIfMissing = true)
public class SilentWavSynthesisProvider implements SpeechSynthesisProvider {

    private static final Logger LOG = LogManager.getLogger(SilentWavSynthesisProvider.class);

    public static final String NAME = "silent-wav";

    static final long MILLIS_PER_CHARACTER = 60;
    static final long MIN_DURATION_MS = 250;
    static final long MAX_DURATION_MS = 30_000;

    @Override
    public SynthesisResult synthesize(String text, String languageCode, String voice) {
        if (text == null || text.isBlank()) {
            throw new ProviderException("Nothing to synthesize", NAME);
        }
        long durationMs = Math.min(MAX_DURATION_MS, Math.max(MIN_DURATION_MS, text.length() * MILLIS_PER_CHARACTER));
        byte[] wav = WavEncoder.encodePcm16LeMono16kHz(new byte[WavEncoder.pcmBytesFor(durationMs)]);
        LOG.debug("Rendered {} ms of silence for {} chars ({})", durationMs, text.length(), languageCode);
        return SynthesisResult.audio(wav, WavEncoder.MIME_TYPE);
    }

    @Override
    public String getProviderName() {
        return NAME;
    }
}
