package com.libragraph.stash.formats.crypto;

/**
 * Sealed data failed authentication.
 */
public class UnsealException extends RuntimeException {

    public UnsealException(String message) {
        super(message);
    }

    public UnsealException(String message, Throwable cause) {
        super(message, cause);
    }
}
