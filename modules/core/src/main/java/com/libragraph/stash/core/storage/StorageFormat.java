package com.libragraph.stash.core.storage;

/**
 * How an object's bytes sit on disk, resolved from its metadata flags.
 */
public enum StorageFormat {
    PLAIN,
    COMPRESSED,
    ENCRYPTED,
    ENCRYPTED_COMPRESSED,
    /** At least one flag is unknown; the reader tries each layout in turn. */
    LEGACY_UNKNOWN;

    public static StorageFormat of(Boolean compressed, Boolean encrypted) {
        if (compressed == null || encrypted == null) {
            return LEGACY_UNKNOWN;
        }
        if (encrypted) {
            return compressed ? ENCRYPTED_COMPRESSED : ENCRYPTED;
        }
        return compressed ? COMPRESSED : PLAIN;
    }

    public boolean isEncrypted() {
        return this == ENCRYPTED || this == ENCRYPTED_COMPRESSED;
    }

    public boolean isCompressed() {
        return this == COMPRESSED || this == ENCRYPTED_COMPRESSED;
    }
}
