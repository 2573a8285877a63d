package com.libragraph.stash.util.buffer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Buffer backed by a temporary file, for decoded plaintext too large to hold
 * on the heap.
 *
 * <p>The spill file may hold decrypted bytes, so it is created readable by the
 * owner only where the file system supports POSIX permissions. It is deleted
 * on {@link #close()}.
 */
public class FileBuffer extends Buffer {

    private final Path path;
    private final FileChannel channel;
    private boolean open = true;

    private static final FileAttribute<?> OWNER_ONLY =
            PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------"));

    public FileBuffer() throws IOException {
        this(Path.of(System.getProperty("java.io.tmpdir")));
    }

    /**
     * Creates a file-backed buffer in {@code directory}.
     */
    public FileBuffer(Path directory) throws IOException {
        this.path = createSpillFile(directory);
        this.channel = FileChannel.open(path,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE,
                StandardOpenOption.DELETE_ON_CLOSE);
    }

    private static Path createSpillFile(Path directory) throws IOException {
        if (directory.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return Files.createTempFile(directory, "stash-plain-", ".tmp", OWNER_ONLY);
        }
        return Files.createTempFile(directory, "stash-plain-", ".tmp");
    }

    @Override
    public long size() {
        try {
            return channel.size();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to get file size", e);
        }
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        return channel.read(dst);
    }

    @Override
    protected int doWrite(ByteBuffer src) throws IOException {
        return channel.write(src);
    }

    @Override
    protected SeekableByteChannel doTruncate(long newSize) throws IOException {
        channel.truncate(newSize);
        if (channel.position() > newSize) {
            channel.position(newSize);
        }
        return this;
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
    public boolean isOpen() {
        return open && channel.isOpen();
    }

    /** Location of the backing temp file; gone once closed. */
    public Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        if (open) {
            open = false;
            channel.close();
            Files.deleteIfExists(path);
        }
    }
}
