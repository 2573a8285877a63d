package com.libragraph.stash.core.storage;

import com.libragraph.stash.util.ContentHash;
import org.apache.commons.codec.binary.Hex;

import java.nio.file.Path;

/**
 * Describes a committed object file.
 *
 * @param path        final location
 * @param size        plaintext byte count
 * @param contentType sniffed MIME type of the plaintext
 * @param checksum    SHA-256 of the plaintext
 * @param compressed  whether the file holds a Zstandard frame
 * @param encrypted   whether the file is {@code nonce || sealed}
 * @param nonce       AEAD nonce, null when not encrypted
 */
public record WriteResult(
        Path path,
        long size,
        String contentType,
        ContentHash checksum,
        boolean compressed,
        boolean encrypted,
        byte[] nonce
) {

    public String storageName() {
        return path.getFileName().toString();
    }

    public String nonceHex() {
        return nonce == null ? null : Hex.encodeHexString(nonce);
    }
}
