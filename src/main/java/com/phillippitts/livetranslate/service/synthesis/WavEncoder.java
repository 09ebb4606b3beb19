package com.phillippitts.livetranslate.service.synthesis;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Encodes raw PCM into an in-memory WAV container.
 *
 * <p>Format: 16 kHz, 16-bit signed PCM, mono, little-endian. Only this fixed format is
 * supported.
 */
public final class WavEncoder {

    /** Sample rate in Hz. */
    public static final int SAMPLE_RATE = 16_000;
    public static final int BITS_PER_SAMPLE = 16;
    public static final int CHANNELS = 1;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS;  // 2 bytes
    /** Bytes per second at the fixed format. */
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;            // 32,000

    public static final int HEADER_SIZE = 44;

    public static final String MIME_TYPE = "audio/wav";

    private WavEncoder() {}

    /**
     * Wraps PCM16LE mono 16 kHz samples in a RIFF/WAVE header.
     *
     * @param pcm raw samples
     * @return complete WAV file bytes
     */
    public static byte[] encodePcm16LeMono16kHz(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream(HEADER_SIZE + pcm.length);

        out.writeBytes(new byte[] {'R', 'I', 'F', 'F'});
        // ChunkSize: 36 + data size
        writeLEInt(out, 36 + pcm.length);
        out.writeBytes(new byte[] {'W', 'A', 'V', 'E'});

        out.writeBytes(new byte[] {'f', 'm', 't', ' '});
        writeLEInt(out, 16);
        // AudioFormat: 1 = PCM
        writeLEShort(out, 1);
        writeLEShort(out, CHANNELS);
        writeLEInt(out, SAMPLE_RATE);
        writeLEInt(out, BYTE_RATE);
        writeLEShort(out, BLOCK_ALIGN);
        writeLEShort(out, BITS_PER_SAMPLE);

        out.writeBytes(new byte[] {'d', 'a', 't', 'a'});
        writeLEInt(out, pcm.length);
        out.writeBytes(pcm);
        return out.toByteArray();
    }

    /** Number of PCM bytes for {@code millis} of audio, rounded down to whole frames. */
    public static int pcmBytesFor(long millis) {
        long frames = SAMPLE_RATE * Math.max(0, millis) / 1000;
        return Math.toIntExact(frames * BLOCK_ALIGN);
    }

    private static void writeLEShort(ByteArrayOutputStream out, int v) {
        out.write(v & 0xFF);
        out.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(ByteArrayOutputStream out, int v) {
        out.write(v & 0xFF);
        out.write((v >>> 8) & 0xFF);
        out.write((v >>> 16) & 0xFF);
        out.write((v >>> 24) & 0xFF);
    }
}
