package com.libragraph.stash.core.storage;

/**
 * An upload or metadata change was refused before anything was committed.
 */
public class ObjectRejectedException extends RuntimeException {

    public enum Reason {
        EXTENSION_NOT_ALLOWED,
        CONTENT_TYPE_NOT_ALLOWED,
        TOO_LARGE,
        QUOTA_EXCEEDED,
        /** A name, title or subject is blank or longer than its column. */
        INVALID_INPUT
    }

    private final Reason reason;

    public ObjectRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
