package com.libragraph.stash.core.storage;

import com.libragraph.stash.core.config.StashSettings;
import com.libragraph.stash.core.dao.StoredObjectRecord;
import com.libragraph.stash.formats.api.Codec;
import com.libragraph.stash.formats.codecs.ZstdCodec;
import com.libragraph.stash.formats.crypto.AeadCipher;
import com.libragraph.stash.formats.crypto.UnsealException;
import com.libragraph.stash.formats.registry.CodecRegistry;
import com.libragraph.stash.util.ContentHash;
import com.libragraph.stash.util.buffer.BinaryData;
import com.libragraph.stash.util.buffer.Buffer;
import com.libragraph.stash.util.buffer.RamBuffer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.codec.binary.Hex;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Optional;

/**
 * Reverses the write pipeline for a stored object and verifies the result
 * against its recorded size and SHA-256 before handing out any byte.
 */
@ApplicationScoped
public class ObjectReader {

    private static final Logger log = Logger.getLogger(ObjectReader.class);

    private final StashSettings settings;
    private final FilesystemObjectStore store;
    private final Codec codec;

    @Inject
    public ObjectReader(StashSettings settings, FilesystemObjectStore store, CodecRegistry codecs) {
        this.settings = settings;
        this.store = store;
        this.codec = codecs.require(ZstdCodec.NAME);
    }

    /**
     * @throws IntegrityException  when the plaintext does not match the metadata
     * @throws DecryptionException when an encrypted object cannot be opened
     * @throws StorageException    when the file is missing or unreadable
     */
    public ObjectContent read(StoredObjectRecord object) {
        Path path = store.resolve(object.storageName());
        if (!Files.isRegularFile(path)) {
            throw StorageException.missing(object.id(), object.storageName());
        }
        StorageFormat format = StorageFormat.of(object.compressed(), object.encrypted());
        long limit = object.size() != null ? object.size() : settings.maxObjectBytes();

        Buffer plaintext;
        try (BinaryData stored = load(path)) {
            long sizeHint = object.size() != null ? object.size() : stored.size();
            plaintext = switch (format) {
                case PLAIN -> copyBounded(object, stored.inputStream(0), sizeHint, limit);
                case COMPRESSED -> inflateBounded(object, stored.inputStream(0), sizeHint, limit);
                case ENCRYPTED -> copyBounded(object,
                        new ByteArrayInputStream(decrypt(object, readAll(stored))), sizeHint, limit);
                case ENCRYPTED_COMPRESSED -> inflateBounded(object,
                        new ByteArrayInputStream(decrypt(object, readAll(stored))), sizeHint, limit);
                case LEGACY_UNKNOWN -> readLegacy(object, stored, sizeHint, limit);
            };
        } catch (IOException e) {
            throw new StorageException(object.storageName(), "Failed to read object " + object.id(), e);
        }

        try {
            verify(object, plaintext);
        } catch (RuntimeException e) {
            release(plaintext, e);
            throw e;
        }
        return new ObjectContent(plaintext, settings.chunkSize());
    }

    private BinaryData load(Path path) throws IOException {
        if (Files.size(path) <= settings.inMemoryThreshold()) {
            return new RamBuffer(Files.readAllBytes(path));
        }
        return BinaryData.wrap(FileChannel.open(path, StandardOpenOption.READ));
    }

    private static byte[] readAll(BinaryData stored) throws IOException {
        return stored.inputStream(0).readAllBytes();
    }

    private byte[] decrypt(StoredObjectRecord object, byte[] stored) {
        AeadCipher cipher = settings.cipher().orElseThrow(() ->
                new DecryptionException(object.id(), "no encryption key configured"));
        if (stored.length < AeadCipher.NONCE_LENGTH + AeadCipher.TAG_LENGTH) {
            throw new DecryptionException(object.id(), "stored data truncated");
        }
        byte[] nonce = Arrays.copyOfRange(stored, 0, AeadCipher.NONCE_LENGTH);
        String recordedNonce = object.encryptionNonceHex();
        if (recordedNonce != null && !recordedNonce.equalsIgnoreCase(Hex.encodeHexString(nonce))) {
            throw new IntegrityException(object.id(), "nonce on disk differs from recorded nonce");
        }
        try {
            return cipher.open(nonce, Arrays.copyOfRange(stored, AeadCipher.NONCE_LENGTH, stored.length));
        } catch (UnsealException e) {
            throw new DecryptionException(object.id(), "authentication failed", e);
        }
    }

    /**
     * Legacy rows: try to open the bytes when a key is configured, fall back
     * to treating them as plaintext, then inflate only if a frame header is
     * present. Verification afterwards still catches any wrong guess.
     */
    private Buffer readLegacy(StoredObjectRecord object, BinaryData stored, long sizeHint, long limit)
            throws IOException {
        byte[] header;
        InputStream source;
        Optional<AeadCipher> cipher = settings.cipher();
        if (cipher.isPresent() && !Boolean.FALSE.equals(object.encrypted())) {
            byte[] raw = readAll(stored);
            byte[] bytes = tryOpen(cipher.get(), raw).orElse(raw);
            if (bytes != raw) {
                log.debugf("Legacy object %d opened with the configured key", object.id());
            }
            header = Arrays.copyOf(bytes, Math.min(bytes.length, CodecRegistry.HEADER_SIZE));
            source = new ByteArrayInputStream(bytes);
        } else {
            header = stored.readHeader(CodecRegistry.HEADER_SIZE);
            source = stored.inputStream(0);
        }

        if (!Boolean.FALSE.equals(object.compressed()) && codec.matches(header)) {
            return inflateBounded(object, source, sizeHint, limit);
        }
        return copyBounded(object, source, sizeHint, limit);
    }

    private static Optional<byte[]> tryOpen(AeadCipher cipher, byte[] raw) {
        if (raw.length < AeadCipher.NONCE_LENGTH + AeadCipher.TAG_LENGTH) {
            return Optional.empty();
        }
        try {
            return Optional.of(cipher.open(
                    Arrays.copyOfRange(raw, 0, AeadCipher.NONCE_LENGTH),
                    Arrays.copyOfRange(raw, AeadCipher.NONCE_LENGTH, raw.length)));
        } catch (UnsealException e) {
            return Optional.empty();
        }
    }

    private Buffer inflateBounded(StoredObjectRecord object, InputStream source, long sizeHint, long limit) {
        try (InputStream decoded = codec.decoder(source)) {
            return copyBounded(object, decoded, sizeHint, limit);
        } catch (IOException e) {
            throw new IntegrityException(object.id(), "corrupt compressed frame", e);
        }
    }

    private Buffer copyBounded(StoredObjectRecord object, InputStream source, long sizeHint, long limit) {
        Buffer out = Buffer.allocate(Math.min(sizeHint, limit));
        try {
            byte[] chunk = new byte[settings.chunkSize()];
            long total = 0;
            int n;
            while ((n = source.read(chunk)) != -1) {
                total += n;
                if (total > limit) {
                    throw new IntegrityException(object.id(), "plaintext exceeds " + limit + " bytes");
                }
                out.write(ByteBuffer.wrap(chunk, 0, n));
            }
            return out;
        } catch (IOException e) {
            IntegrityException failure = new IntegrityException(object.id(), "unreadable stored data", e);
            release(out, failure);
            throw failure;
        } catch (RuntimeException e) {
            release(out, e);
            throw e;
        }
    }

    private void verify(StoredObjectRecord object, Buffer plaintext) {
        if (object.size() != null && plaintext.size() != object.size()) {
            throw new IntegrityException(object.id(),
                    "size " + plaintext.size() + " differs from recorded " + object.size());
        }
        if (object.checksumSha256() == null) {
            log.warnf("Object %d has no recorded checksum, serving unverified", object.id());
            return;
        }
        ContentHash expected;
        try {
            expected = ContentHash.fromHex(object.checksumSha256());
        } catch (IllegalArgumentException e) {
            throw new IntegrityException(object.id(), "malformed recorded checksum", e);
        }
        if (!expected.equals(plaintext.hash())) {
            throw new IntegrityException(object.id(), "checksum mismatch");
        }
    }

    private static void release(Buffer buffer, RuntimeException failure) {
        try {
            buffer.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
