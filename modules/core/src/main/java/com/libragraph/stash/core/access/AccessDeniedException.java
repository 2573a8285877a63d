package com.libragraph.stash.core.access;

/**
 * The caller may not perform the requested operation on a resource.
 */
public class AccessDeniedException extends RuntimeException {

    private final long callerId;

    public AccessDeniedException(long callerId, String resource) {
        super("Access denied for caller " + callerId + " to " + resource);
        this.callerId = callerId;
    }

    public long callerId() {
        return callerId;
    }
}
