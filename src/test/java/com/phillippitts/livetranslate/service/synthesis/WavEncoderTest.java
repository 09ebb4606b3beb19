package com.phillippitts.livetranslate.service.synthesis;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WavEncoderTest {

    @Test
    void writesCanonicalHeader() {
        byte[] pcm = new byte[3200];
        byte[] wav = WavEncoder.encodePcm16LeMono16kHz(pcm);
        ByteBuffer header = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);

        assertThat(wav).hasSize(WavEncoder.HEADER_SIZE + pcm.length);
        assertThat(header.getInt(4)).isEqualTo(36 + pcm.length);
        assertThat(header.getShort(20)).isEqualTo((short) 1);
        assertThat(header.getShort(22)).isEqualTo((short) WavEncoder.CHANNELS);
        assertThat(header.getInt(24)).isEqualTo(WavEncoder.SAMPLE_RATE);
        assertThat(header.getInt(28)).isEqualTo(WavEncoder.BYTE_RATE);
        assertThat(header.getShort(34)).isEqualTo((short) WavEncoder.BITS_PER_SAMPLE);
        assertThat(header.getInt(40)).isEqualTo(pcm.length);
    }

    @Test
    void computesWholeFrames() {
        assertThat(WavEncoder.pcmBytesFor(1000)).isEqualTo(WavEncoder.BYTE_RATE);
        assertThat(WavEncoder.pcmBytesFor(-5)).isZero();
        assertThat(WavEncoder.pcmBytesFor(1) % WavEncoder.BLOCK_ALIGN).isZero();
    }

    @Test
    void rejectsNullPcm() {
        assertThatThrownBy(() -> WavEncoder.encodePcm16LeMono16kHz(null)).isInstanceOf(NullPointerException.class);
    }
}
