package com.libragraph.stash.util.buffer;

import com.libragraph.stash.util.ContentHash;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.security.MessageDigest;

/**
 * Writable buffer that extends BinaryData with write capabilities.
 *
 * Supports incremental SHA-256 computation during sequential writes:
 * - Tailing writes (appending) update the digest incrementally
 * - Overwrites invalidate the digest and trigger recomputation
 * - Gaps in writes fall back to full hash computation
 *
 * Factory method allocates the backend (RAM or temp file)
 * based on a size threshold.
 */
public abstract class Buffer extends BinaryData {

    private MessageDigest incrementalHash = ContentHash.newDigest();
    private long hashedUpTo = 0;
    private ContentHash cachedHash = null;

    /** Threshold above which allocate() uses a temp file instead of RAM. */
    public static final long FILE_THRESHOLD = 4L * 1024 * 1024; // 4 MB

    /**
     * Allocates a buffer for the expected size.
     * Chooses backend automatically based on size:
     * <ul>
     *   <li>&lt; 4 MB: {@link RamBuffer} (heap byte array)</li>
     *   <li>&gt;= 4 MB: {@link FileBuffer} (temp-file backed {@link java.nio.channels.FileChannel})</li>
     * </ul>
     */
    public static Buffer allocate(long size) {
        if (size < FILE_THRESHOLD) {
            return new RamBuffer((int) size);
        }
        try {
            return new FileBuffer();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to allocate file-backed buffer", e);
        }
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        long writePos = position();

        cachedHash = null;

        if (writePos < hashedUpTo) {
            // Overwrite detected - restart incremental digest
            incrementalHash = ContentHash.newDigest();
            hashedUpTo = 0;
        } else if (writePos == hashedUpTo) {
            ByteBuffer copy = src.duplicate();
            int length = copy.remaining();
            incrementalHash.update(copy);
            hashedUpTo += length;
        }
        // else: gap (writePos > hashedUpTo) - can't update incrementally

        return doWrite(src);
    }

    @Override
    public SeekableByteChannel truncate(long newSize) throws IOException {
        long currentSize = size();

        if (newSize < currentSize) {
            cachedHash = null;

            if (newSize < hashedUpTo) {
                incrementalHash = ContentHash.newDigest();
                hashedUpTo = 0;
            }
        }

        return doTruncate(newSize);
    }

    @Override
    public ContentHash hash() {
        if (cachedHash != null) {
            return cachedHash;
        }

        if (hashedUpTo == size()) {
            // Fully hashed incrementally; finish a clone so appends can continue
            try {
                cachedHash = ContentHash.finish((MessageDigest) incrementalHash.clone());
                return cachedHash;
            } catch (CloneNotSupportedException e) {
                // provider without clone support, fall through to a full pass
            }
        }

        cachedHash = computeFullHash();
        return cachedHash;
    }

    /**
     * Subclasses implement actual write operation.
     */
    protected abstract int doWrite(ByteBuffer src) throws IOException;

    /**
     * Subclasses implement actual truncate operation.
     */
    protected abstract SeekableByteChannel doTruncate(long newSize) throws IOException;

    /**
     * Computes hash by reading entire buffer.
     * Called when incremental hash is not available.
     */
    private ContentHash computeFullHash() {
        try {
            long originalPos = position();
            position(0);

            MessageDigest hasher = ContentHash.newDigest();
            ByteBuffer buffer = ByteBuffer.allocate(8192);

            while (read(buffer) != -1) {
                buffer.flip();
                hasher.update(buffer);
                buffer.clear();
            }

            position(originalPos);
            return ContentHash.finish(hasher);

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compute hash", e);
        }
    }
}
