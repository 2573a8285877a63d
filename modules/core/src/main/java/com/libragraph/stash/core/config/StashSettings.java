package com.libragraph.stash.core.config;

import com.libragraph.stash.formats.crypto.AeadCipher;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable storage settings, produced once from {@code stash.*} configuration.
 *
 * @param storageRoot          flat directory holding every stored object
 * @param maxObjectBytes       per-object plaintext ceiling
 * @param maxOwnerBytes        per-owner quota
 * @param allowedExtensions    lowercase extensions without dot
 * @param allowedMimePrefixes  sniffed content types must start with one of these
 * @param compressionEnabled   whether non-image objects are compressed
 * @param cipher               present when encryption at rest is configured
 * @param inMemoryThreshold    stored files up to this size are read fully into memory
 * @param chunkSize            streaming chunk size for writes and downloads
 */
public record StashSettings(
        Path storageRoot,
        long maxObjectBytes,
        long maxOwnerBytes,
        Set<String> allowedExtensions,
        List<String> allowedMimePrefixes,
        boolean compressionEnabled,
        Optional<AeadCipher> cipher,
        long inMemoryThreshold,
        int chunkSize
) {

    public static final long DEFAULT_MAX_OBJECT_BYTES = 25L * 1024 * 1024;
    public static final long DEFAULT_MAX_OWNER_BYTES = 200L * 1024 * 1024;
    public static final long DEFAULT_IN_MEMORY_THRESHOLD = 4L * 1024 * 1024;
    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    public StashSettings {
        if (maxObjectBytes <= 0 || maxOwnerBytes <= 0) {
            throw new IllegalArgumentException("Size limits must be positive");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        allowedExtensions = allowedExtensions.stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .filter(e -> !e.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        allowedMimePrefixes = List.copyOf(allowedMimePrefixes);
    }

    /**
     * Settings with the shipped defaults, no encryption.
     */
    public static StashSettings defaults(Path storageRoot) {
        return new StashSettings(storageRoot,
                DEFAULT_MAX_OBJECT_BYTES,
                DEFAULT_MAX_OWNER_BYTES,
                Set.of("pdf", "png", "jpg", "jpeg", "txt", "md"),
                List.of("image/", "text/", "application/pdf"),
                true,
                Optional.empty(),
                DEFAULT_IN_MEMORY_THRESHOLD,
                DEFAULT_CHUNK_SIZE);
    }

    public StashSettings withMaxObjectBytes(long value) {
        return new StashSettings(storageRoot, value, maxOwnerBytes, allowedExtensions,
                allowedMimePrefixes, compressionEnabled, cipher, inMemoryThreshold, chunkSize);
    }

    public StashSettings withMaxOwnerBytes(long value) {
        return new StashSettings(storageRoot, maxObjectBytes, value, allowedExtensions,
                allowedMimePrefixes, compressionEnabled, cipher, inMemoryThreshold, chunkSize);
    }

    public StashSettings withCompression(boolean enabled) {
        return new StashSettings(storageRoot, maxObjectBytes, maxOwnerBytes, allowedExtensions,
                allowedMimePrefixes, enabled, cipher, inMemoryThreshold, chunkSize);
    }

    public StashSettings withCipher(AeadCipher value) {
        return new StashSettings(storageRoot, maxObjectBytes, maxOwnerBytes, allowedExtensions,
                allowedMimePrefixes, compressionEnabled, Optional.ofNullable(value), inMemoryThreshold, chunkSize);
    }

    public StashSettings withInMemoryThreshold(long value) {
        return new StashSettings(storageRoot, maxObjectBytes, maxOwnerBytes, allowedExtensions,
                allowedMimePrefixes, compressionEnabled, cipher, value, chunkSize);
    }

    public boolean isExtensionAllowed(String extension) {
        return extension != null && allowedExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }
}
