package com.libragraph.stash.core.config;

import com.libragraph.stash.formats.crypto.AeadCipher;
import com.libragraph.stash.formats.crypto.AesGcmCipher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@ApplicationScoped
public class StashSettingsProducer {

    private static final Logger log = Logger.getLogger(StashSettingsProducer.class);

    @ConfigProperty(name = "stash.storage.root")
    String storageRoot;

    @ConfigProperty(name = "stash.upload.max-object-bytes", defaultValue = "26214400")
    long maxObjectBytes;

    @ConfigProperty(name = "stash.upload.max-owner-bytes", defaultValue = "209715200")
    long maxOwnerBytes;

    @ConfigProperty(name = "stash.upload.allowed-extensions", defaultValue = "pdf,png,jpg,jpeg,txt,md")
    List<String> allowedExtensions;

    @ConfigProperty(name = "stash.upload.allowed-mime-prefixes", defaultValue = "image/,text/,application/pdf")
    List<String> allowedMimePrefixes;

    @ConfigProperty(name = "stash.compression.enabled", defaultValue = "true")
    boolean compressionEnabled;

    @ConfigProperty(name = "stash.encryption.key")
    Optional<String> encryptionKey;

    @ConfigProperty(name = "stash.read.in-memory-threshold", defaultValue = "4194304")
    long inMemoryThreshold;

    @ConfigProperty(name = "stash.read.chunk-size", defaultValue = "65536")
    int chunkSize;

    @Produces
    @Singleton
    public StashSettings stashSettings() {
        Optional<AeadCipher> cipher = encryptionKey
                .filter(k -> !k.isBlank())
                .map(StashSettingsProducer::parseKey);
        log.infof("Stash storage at %s (compression=%s, encryption=%s)",
                storageRoot, compressionEnabled, cipher.isPresent());
        return new StashSettings(Path.of(storageRoot),
                maxObjectBytes,
                maxOwnerBytes,
                Set.copyOf(allowedExtensions),
                allowedMimePrefixes,
                compressionEnabled,
                cipher,
                inMemoryThreshold,
                chunkSize);
    }

    private static AeadCipher parseKey(String hex) {
        try {
            return AesGcmCipher.fromHex(hex);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid stash.encryption.key: " + e.getMessage(), e);
        }
    }
}
