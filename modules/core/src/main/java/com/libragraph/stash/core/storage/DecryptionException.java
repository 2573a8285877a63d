package com.libragraph.stash.core.storage;

/**
 * An encrypted object could not be opened: wrong or missing key, tampering or truncation.
 */
public class DecryptionException extends RuntimeException {

    private final long objectId;

    public DecryptionException(long objectId, String message) {
        super("Cannot decrypt object " + objectId + ": " + message);
        this.objectId = objectId;
    }

    public DecryptionException(long objectId, String message, Throwable cause) {
        super("Cannot decrypt object " + objectId + ": " + message, cause);
        this.objectId = objectId;
    }

    public long objectId() {
        return objectId;
    }
}
