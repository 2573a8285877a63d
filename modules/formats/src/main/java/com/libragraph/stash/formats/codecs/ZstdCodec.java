package com.libragraph.stash.formats.codecs;

import com.libragraph.stash.formats.api.Codec;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.compress.compressors.zstandard.ZstdCompressorInputStream;
import org.apache.commons.compress.compressors.zstandard.ZstdCompressorOutputStream;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Zstandard frames via Apache Commons Compress (native zstd-jni underneath).
 */
@ApplicationScoped
public class ZstdCodec implements Codec {

    /** Frame magic 0xFD2FB528, little-endian on disk. */
    private static final byte[] ZSTD_MAGIC = new byte[]{0x28, (byte) 0xB5, 0x2F, (byte) 0xFD};

    public static final String NAME = "zstd";

    private final int level;

    @Inject
    public ZstdCodec(@ConfigProperty(name = "stash.compression.level", defaultValue = "6") int level) {
        if (level < 1 || level > 22) {
            throw new IllegalArgumentException("Zstd level must be 1-22, got: " + level);
        }
        this.level = level;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean matches(byte[] header) {
        if (header == null || header.length < ZSTD_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < ZSTD_MAGIC.length; i++) {
            if (header[i] != ZSTD_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public OutputStream encoder(OutputStream sink) throws IOException {
        return new ZstdCompressorOutputStream(sink, level);
    }

    @Override
    public InputStream decoder(InputStream source) throws IOException {
        return new ZstdCompressorInputStream(source);
    }
}
