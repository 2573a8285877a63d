package com.libragraph.stash.core.storage;

import java.util.Optional;

/**
 * The storage root could not be read or written. Carries the on-disk name of
 * the object involved when there is one.
 */
public class StorageException extends RuntimeException {

    private final String storageName;

    public StorageException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public StorageException(String message) {
        this(null, message, null);
    }

    public StorageException(String storageName, String message, Throwable cause) {
        super(message, cause);
        this.storageName = storageName;
    }

    /**
     * Metadata names a file that is not in the storage root.
     */
    public static StorageException missing(long objectId, String storageName) {
        return new StorageException(storageName, "Stored file missing for object " + objectId, null);
    }

    public Optional<String> storageName() {
        return Optional.ofNullable(storageName);
    }
}
