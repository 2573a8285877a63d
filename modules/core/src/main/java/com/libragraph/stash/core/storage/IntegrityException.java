package com.libragraph.stash.core.storage;

/**
 * Stored bytes do not reproduce the recorded checksum or size.
 */
public class IntegrityException extends RuntimeException {

    private final long objectId;

    public IntegrityException(long objectId, String message) {
        super("Integrity check failed for object " + objectId + ": " + message);
        this.objectId = objectId;
    }

    public IntegrityException(long objectId, String message, Throwable cause) {
        super("Integrity check failed for object " + objectId + ": " + message, cause);
        this.objectId = objectId;
    }

    public long objectId() {
        return objectId;
    }
}
