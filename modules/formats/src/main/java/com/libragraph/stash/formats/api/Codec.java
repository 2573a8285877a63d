package com.libragraph.stash.formats.api;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stateless streaming compression codec.
 *
 * <p>Codecs produce self-delimited frames: a frame can be decoded without
 * knowing the original size in advance. Implementations should be
 * {@code @ApplicationScoped} CDI beans and safe to share across threads;
 * the streams they return are not.
 */
public interface Codec {

    /**
     * Short lowercase identifier, e.g. {@code "zstd"}.
     */
    String name();

    /**
     * Checks whether the header starts with this codec's frame signature.
     *
     * @param header first bytes of the data (at least 4 bytes for a match)
     */
    boolean matches(byte[] header);

    /**
     * Wraps a sink with an encoding stream. Closing the returned stream
     * finalizes the frame and closes the sink.
     */
    OutputStream encoder(OutputStream sink) throws IOException;

    /**
     * Wraps a source with a decoding stream. Closing the returned stream
     * closes the source.
     */
    InputStream decoder(InputStream source) throws IOException;
}
