package com.libragraph.stash.core.storage;

import com.libragraph.stash.core.config.StashSettings;
import com.libragraph.stash.formats.api.Codec;
import com.libragraph.stash.formats.codecs.ZstdCodec;
import com.libragraph.stash.formats.crypto.AeadCipher;
import com.libragraph.stash.formats.registry.CodecRegistry;
import com.libragraph.stash.formats.sniff.ContentSniffer;
import com.libragraph.stash.formats.sniff.SniffResult;
import com.libragraph.stash.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.util.Arrays;

/**
 * Streams an upload into a temp file next to its destination and renames it
 * into place only once it is complete, durable and accepted.
 *
 * <p>A reader never observes a partial file under a final name, and no
 * failure leaves a temp file behind.
 */
@ApplicationScoped
public class AtomicObjectWriter {

    private static final Logger log = Logger.getLogger(AtomicObjectWriter.class);

    private final StashSettings settings;
    private final ContentSniffer sniffer;
    private final Codec codec;

    @Inject
    public AtomicObjectWriter(StashSettings settings, ContentSniffer sniffer, CodecRegistry codecs) {
        this.settings = settings;
        this.sniffer = sniffer;
        this.codec = codecs.require(ZstdCodec.NAME);
    }

    /**
     * Writes {@code source} to {@code directory/storageName}.
     *
     * @throws ObjectRejectedException when the object is too large or its content type is not allowed
     * @throws StorageException        on any I/O failure
     */
    public WriteResult write(InputStream source, Path directory, String storageName) {
        return write(source, directory, storageName, true);
    }

    /**
     * Same as {@link #write(InputStream, Path, String)}; with {@code enforceContentType}
     * false the sniffed type is recorded but not checked against the allow-list.
     * Meant for content the server generates itself.
     */
    public WriteResult write(InputStream source, Path directory, String storageName,
                             boolean enforceContentType) {
        Path target = directory.resolve(storageName);
        try (PendingFile pending = PendingFile.create(directory)) {
            Copied copied = copy(source, pending.path());

            boolean compressed = copied.compressed();
            if (compressed && Files.size(pending.path()) >= copied.size()) {
                log.debugf("Frame not smaller than %d plaintext bytes, storing %s plain",
                        copied.size(), storageName);
                inflateInPlace(pending.path());
                compressed = false;
            }

            byte[] nonce = null;
            if (settings.cipher().isPresent()) {
                nonce = seal(settings.cipher().get(), pending.path());
            }

            force(pending.path());

            SniffResult sniffed = sniffer.sniff(copied.prefix());
            if (enforceContentType && !sniffed.matchesAny(settings.allowedMimePrefixes())) {
                throw new ObjectRejectedException(ObjectRejectedException.Reason.CONTENT_TYPE_NOT_ALLOWED,
                        "Content type not allowed: " + sniffed.mimeType());
            }

            pending.commit(target);
            log.debugf("Committed %s: %d bytes, type=%s, compressed=%s, encrypted=%s",
                    storageName, copied.size(), sniffed.mimeType(), compressed, nonce != null);
            return new WriteResult(target, copied.size(), sniffed.mimeType(), copied.checksum(),
                    compressed, nonce != null, nonce);
        } catch (IOException e) {
            throw new StorageException(storageName, "Failed to write object: " + storageName, e);
        }
    }

    private record Copied(long size, ContentHash checksum, byte[] prefix, boolean compressed) {}

    private Copied copy(InputStream source, Path temp) throws IOException {
        byte[] chunk = new byte[settings.chunkSize()];
        int n = source.readNBytes(chunk, 0, chunk.length);

        byte[] prefix = Arrays.copyOf(chunk, Math.min(n, ContentSniffer.MAX_PREFIX));
        boolean compress = settings.compressionEnabled() && !sniffer.sniff(prefix).isImage();

        MessageDigest digest = ContentHash.newDigest();
        long total = 0;
        try (OutputStream file = new BufferedOutputStream(Files.newOutputStream(temp,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING));
             OutputStream sink = compress ? codec.encoder(file) : file) {
            while (n > 0) {
                total += n;
                if (total > settings.maxObjectBytes()) {
                    throw new ObjectRejectedException(ObjectRejectedException.Reason.TOO_LARGE,
                            "Object exceeds " + settings.maxObjectBytes() + " bytes");
                }
                digest.update(chunk, 0, n);
                sink.write(chunk, 0, n);
                n = source.readNBytes(chunk, 0, chunk.length);
            }
        }
        return new Copied(total, ContentHash.finish(digest), prefix, compress);
    }

    private void inflateInPlace(Path file) throws IOException {
        try (PendingFile plain = PendingFile.create(file.getParent())) {
            try (InputStream in = codec.decoder(new BufferedInputStream(Files.newInputStream(file)));
                 OutputStream out = Files.newOutputStream(plain.path(), StandardOpenOption.TRUNCATE_EXISTING)) {
                in.transferTo(out);
            }
            Files.move(plain.path(), file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Replaces the file content with {@code nonce || seal(content)}.
     */
    private static byte[] seal(AeadCipher cipher, Path file) throws IOException {
        byte[] nonce = cipher.newNonce();
        byte[] sealed = cipher.seal(nonce, Files.readAllBytes(file));
        try (FileChannel ch = FileChannel.open(file,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            writeFully(ch, ByteBuffer.wrap(nonce));
            writeFully(ch, ByteBuffer.wrap(sealed));
        }
        return nonce;
    }

    private static void writeFully(FileChannel ch, ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) {
            ch.write(buf);
        }
    }

    private static void force(Path file) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ch.force(true);
        }
    }
}
