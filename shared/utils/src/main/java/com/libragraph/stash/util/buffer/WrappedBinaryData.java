package com.libragraph.stash.util.buffer;

import com.libragraph.stash.util.ContentHash;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.security.MessageDigest;

/**
 * Read-only view over a channel, typically a {@link java.nio.channels.FileChannel}
 * opened on a stored object. The hash is computed once, on first access.
 */
class WrappedBinaryData extends BinaryData {

    private final SeekableByteChannel channel;
    private ContentHash cachedHash;

    WrappedBinaryData(SeekableByteChannel channel) {
        this.channel = channel;
    }

    @Override
    public ContentHash hash() {
        if (cachedHash == null) {
            cachedHash = computeHash();
        }
        return cachedHash;
    }

    @Override
    public long size() {
        try {
            return channel.size();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to get size", e);
        }
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        return channel.read(dst);
    }

    @Override
    public int write(ByteBuffer src) {
        throw new NonWritableChannelException();
    }

    @Override
    public long position() throws IOException {
        return channel.position();
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        channel.position(newPosition);
        return this;
    }

    @Override
    public SeekableByteChannel truncate(long size) {
        throw new NonWritableChannelException();
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    // Restores the caller's position; reads from the start in 64 KiB steps.
    private ContentHash computeHash() {
        try {
            long resumeAt = channel.position();
            channel.position(0);
            MessageDigest digest = ContentHash.newDigest();
            ByteBuffer step = ByteBuffer.allocate(64 * 1024);
            while (channel.read(step) != -1) {
                digest.update(step.flip());
                step.clear();
            }
            channel.position(resumeAt);
            return ContentHash.finish(digest);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash wrapped channel", e);
        }
    }
}
