package com.libragraph.stash.core.storage;

/**
 * Thrown when a lookup targets an object id with no metadata row.
 */
public class ObjectNotFoundException extends RuntimeException {

    private final long objectId;

    public ObjectNotFoundException(long objectId) {
        super("Object not found: " + objectId);
        this.objectId = objectId;
    }

    public long objectId() {
        return objectId;
    }
}
