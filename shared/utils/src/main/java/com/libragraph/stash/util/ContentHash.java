package com.libragraph.stash.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 digest of an object's original plaintext (32 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>Always computed over plaintext, before compression or encryption, so a
 * stored checksum stays valid whatever storage policy wrote the bytes.
 */
public record ContentHash(byte[] bytes) {
    private static final int HASH_LENGTH = 32; // 256 bits
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 32 bytes (SHA-256), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Hashes an in-memory byte array.
     */
    public static ContentHash of(byte[] data) {
        return new ContentHash(DigestUtils.sha256(data));
    }

    /**
     * Returns a fresh SHA-256 digest for incremental hashing.
     */
    public static MessageDigest newDigest() {
        return DigestUtils.getSha256Digest();
    }

    /**
     * Finalizes the given digest into a ContentHash. Resets the digest.
     */
    public static ContentHash finish(MessageDigest digest) {
        return new ContentHash(digest.digest());
    }

    /**
     * Creates ContentHash from hex string (64 characters, any case).
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != 64) {
            throw new IllegalArgumentException(
                "SHA-256 hex string must be 64 characters, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Returns lowercase hex representation (64 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return MessageDigest.isEqual(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
