package com.libragraph.stash.core.storage;

import com.libragraph.stash.core.config.StashSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;

/**
 * Flat on-disk object directory.
 *
 * <p>Layout: {@code {root}/{storageName}} where the storage name is an
 * unguessable random token plus the sanitized extension. Names never carry
 * user-supplied path components.
 */
@ApplicationScoped
public class FilesystemObjectStore {

    private static final Logger log = Logger.getLogger(FilesystemObjectStore.class);

    private static final int TOKEN_BYTES = 24;
    private static final int MAX_EXTENSION = 10;

    private final Path root;
    private final SecureRandom random = new SecureRandom();

    @Inject
    public FilesystemObjectStore(StashSettings settings) {
        this.root = settings.storageRoot().toAbsolutePath().normalize();
        try {
            if (!Files.isDirectory(root)) {
                Files.createDirectories(root);
                if (root.getFileSystem().supportedFileAttributeViews().contains("posix")) {
                    Files.setPosixFilePermissions(root, PosixFilePermissions.fromString("rwx------"));
                }
                log.infof("Created storage root %s", root);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot create storage root: " + root, e);
        }
    }

    public Path root() {
        return root;
    }

    /**
     * Fresh storage name for an object whose logical name has the given extension.
     */
    public String newStorageName(String extension) {
        byte[] token = new byte[TOKEN_BYTES];
        random.nextBytes(token);
        String name = Base64.getUrlEncoder().withoutPadding().encodeToString(token);
        String ext = sanitizeExtension(extension);
        return ext.isEmpty() ? name : name + "." + ext;
    }

    /**
     * Resolves a storage name inside the root, refusing anything that could escape it.
     */
    public Path resolve(String storageName) {
        if (storageName == null || storageName.isEmpty()
                || storageName.startsWith(".")
                || storageName.contains("/") || storageName.contains("\\")) {
            throw new StorageException("Invalid storage name: " + storageName);
        }
        Path path = root.resolve(storageName).normalize();
        if (!path.getParent().equals(root)) {
            throw new StorageException("Invalid storage name: " + storageName);
        }
        return path;
    }

    /**
     * Size of the stored file, 0 when it is missing.
     */
    public long sizeOnDisk(String storageName) {
        try {
            return Files.size(resolve(storageName));
        } catch (NoSuchFileException e) {
            return 0L;
        } catch (IOException e) {
            throw new StorageException(storageName, "Failed to stat object: " + storageName, e);
        }
    }

    /**
     * Deletes a stored file; a file that is already gone is not an error.
     *
     * @return true if a file was removed
     */
    public boolean delete(String storageName) {
        try {
            boolean removed = Files.deleteIfExists(resolve(storageName));
            if (!removed) {
                log.debugf("Object file already absent: %s", storageName);
            }
            return removed;
        } catch (IOException e) {
            throw new StorageException(storageName, "Failed to delete object: " + storageName, e);
        }
    }

    /**
     * Best-effort removal used on failure paths, where the original error must win.
     */
    public void discard(String storageName) {
        try {
            delete(storageName);
        } catch (StorageException e) {
            log.warnf(e, "Could not remove orphaned object file %s", storageName);
        }
    }

    static String sanitizeExtension(String extension) {
        if (extension == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (char c : extension.toLowerCase(Locale.ROOT).toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            }
            if (sb.length() == MAX_EXTENSION) {
                break;
            }
        }
        return sb.toString();
    }
}
