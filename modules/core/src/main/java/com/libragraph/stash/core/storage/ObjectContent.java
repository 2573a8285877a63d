package com.libragraph.stash.core.storage;

import com.libragraph.stash.util.ContentHash;
import com.libragraph.stash.util.buffer.Buffer;
import io.smallrye.mutiny.Multi;
import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Verified plaintext of a stored object, held in RAM or in a temp file
 * depending on size. Each accessor reads from the start; the stream
 * returned by {@link #inputStream()} and the {@link #chunks()} stream
 * release the content when they finish.
 */
public class ObjectContent implements Closeable {

    private static final Logger log = Logger.getLogger(ObjectContent.class);

    private final Buffer plaintext;
    private final int chunkSize;

    ObjectContent(Buffer plaintext, int chunkSize) {
        this.plaintext = plaintext;
        this.chunkSize = chunkSize;
    }

    public long size() {
        return plaintext.size();
    }

    public ContentHash checksum() {
        return plaintext.hash();
    }

    public byte[] bytes() {
        long size = plaintext.size();
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("Object too large for a byte array: " + size);
        }
        try {
            plaintext.position(0);
            ByteBuffer out = ByteBuffer.allocate((int) size);
            while (out.hasRemaining() && plaintext.read(out) != -1) {
                // fill
            }
            return out.array();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read object content", e);
        }
    }

    /**
     * Stream over the plaintext; closing it closes this content.
     */
    public InputStream inputStream() {
        return plaintext.inputStream(0);
    }

    /**
     * Lazily emits the plaintext in fixed-size chunks (the last one may be shorter),
     * closing this content on completion, failure or cancellation.
     */
    public Multi<byte[]> chunks() {
        return Multi.createFrom().<byte[]>iterable(() -> new ChunkIterator())
                .onTermination().invoke(this::closeQuietly);
    }

    @Override
    public void close() throws IOException {
        plaintext.close();
    }

    private void closeQuietly() {
        try {
            close();
        } catch (IOException e) {
            log.warnf(e, "Failed to release object content");
        }
    }

    private final class ChunkIterator implements Iterator<byte[]> {
        private long offset;

        @Override
        public boolean hasNext() {
            return offset < plaintext.size();
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int length = (int) Math.min(chunkSize, plaintext.size() - offset);
            ByteBuffer chunk = ByteBuffer.allocate(length);
            try {
                plaintext.position(offset);
                while (chunk.hasRemaining() && plaintext.read(chunk) != -1) {
                    // fill
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read object chunk", e);
            }
            offset += length;
            return chunk.array();
        }
    }
}
