package com.libragraph.stash.util.buffer;

import com.libragraph.stash.util.ContentHash;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;

/**
 * Read-only binary data backed by RAM or by a file channel.
 *
 * Implements SeekableByteChannel for direct channel-based access.
 * Provides convenience methods for stream-based access and signature sniffing.
 *
 * Design principles:
 * - Hash and size are always available
 * - Stream access uses standard JDK wrappers (Channels.newInputStream)
 * - Header reads are capped so sniffing never loads a whole object
 */
public abstract class BinaryData implements SeekableByteChannel {

    /**
     * Wraps an existing SeekableByteChannel as BinaryData.
     * Hash will be computed lazily on first access.
     */
    public static BinaryData wrap(SeekableByteChannel channel) {
        return new WrappedBinaryData(channel);
    }

    /**
     * SHA-256 of this binary data.
     * May be computed lazily on first call.
     */
    public abstract ContentHash hash();

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Opens an InputStream positioned at the given offset.
     *
     * <p>The stream shares this channel's position, so only one stream
     * should be consumed at a time. Closing the stream closes the channel.
     *
     * @param pos starting position (0-based)
     * @return InputStream positioned at offset
     */
    public InputStream inputStream(long pos) {
        try {
            position(pos);
            return Channels.newInputStream(this);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create input stream at position " + pos, e);
        }
    }

    /**
     * Reads the first N bytes as a header (for signature detection).
     * Does not advance the buffer position.
     *
     * Hard limit: min(maxBytes, 64KB) to prevent unbounded reads.
     *
     * @param maxBytes maximum bytes to read
     * @return header bytes (may be shorter than maxBytes if data is smaller)
     */
    public byte[] readHeader(int maxBytes) {
        int limit = Math.min(maxBytes, 64 * 1024);  // Hard 64KB limit
        int toRead = (int) Math.min(limit, size());

        try {
            long originalPos = position();
            position(0);

            ByteBuffer buffer = ByteBuffer.allocate(toRead);
            while (buffer.hasRemaining()) {
                if (read(buffer) == -1) break;
            }

            position(originalPos);  // Restore position

            byte[] header = new byte[buffer.position()];
            buffer.flip();
            buffer.get(header);
            return header;

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read header", e);
        }
    }
}
