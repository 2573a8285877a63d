package com.libragraph.stash.formats.crypto;

/**
 * Authenticated encryption with associated nonce.
 *
 * <p>Sealed output carries its authentication tag; {@link #open} either
 * returns the exact plaintext or throws.
 */
public interface AeadCipher {

    int NONCE_LENGTH = 12;

    int TAG_LENGTH = 16;

    /**
     * Fresh random nonce, unique per sealed object.
     */
    byte[] newNonce();

    byte[] seal(byte[] nonce, byte[] plaintext);

    /**
     * @throws UnsealException on a wrong key, tampered data or truncated input
     */
    byte[] open(byte[] nonce, byte[] sealed);
}
