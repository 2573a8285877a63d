package com.libragraph.stash.formats.codecs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZstdCodecTest {
    private ZstdCodec codec;

    @BeforeEach
    void setUp() {
        codec = new ZstdCodec(6);
    }

    @Test
    void shouldMatchZstdMagicBytes() {
        byte[] header = new byte[]{0x28, (byte) 0xB5, 0x2F, (byte) 0xFD, 0x00};
        assertThat(codec.matches(header)).isTrue();
    }

    @Test
    void shouldNotMatchOtherHeaders() {
        assertThat(codec.matches("Hello".getBytes())).isFalse();
        assertThat(codec.matches(new byte[]{0x28, (byte) 0xB5})).isFalse();
        assertThat(codec.matches(null)).isFalse();
    }

    @Test
    void shouldRejectOutOfRangeLevel() {
        assertThatThrownBy(() -> new ZstdCodec(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ZstdCodec(23)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCompressAndDecompress() throws Exception {
        byte[] original = ("Hello, World! ".repeat(200) + "tail").getBytes(StandardCharsets.UTF_8);

        byte[] compressed = encode(original);
        assertThat(compressed.length).isLessThan(original.length);
        assertThat(codec.matches(Arrays.copyOf(compressed, 4))).isTrue();

        assertThat(decode(compressed)).isEqualTo(original);
    }

    @Test
    void shouldRoundTripEmptyInput() throws Exception {
        byte[] compressed = encode(new byte[0]);
        assertThat(compressed).isNotEmpty();
        assertThat(decode(compressed)).isEmpty();
    }

    @Test
    void shouldExpandTinyInput() throws Exception {
        // frame overhead exceeds the savings on very short input
        byte[] original = "hello world".getBytes(StandardCharsets.UTF_8);
        assertThat(encode(original).length).isGreaterThanOrEqualTo(original.length);
    }

    @Test
    void shouldFailOnGarbage() {
        byte[] garbage = new byte[]{0x28, (byte) 0xB5, 0x2F, (byte) 0xFD, 1, 2, 3, 4, 5};
        assertThatThrownBy(() -> decode(garbage)).isInstanceOf(IOException.class);
    }

    private byte[] encode(byte[] data) throws IOException {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        try (OutputStream out = codec.encoder(sink)) {
            out.write(data);
        }
        return sink.toByteArray();
    }

    private byte[] decode(byte[] data) throws IOException {
        try (InputStream in = codec.decoder(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }
}
