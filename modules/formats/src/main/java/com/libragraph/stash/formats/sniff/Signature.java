package com.libragraph.stash.formats.sniff;

import java.util.Arrays;

/**
 * Fixed magic-byte signature mapped to a MIME type.
 *
 * @param mimeType    MIME type reported on a match
 * @param magicBytes  bytes that must appear verbatim
 * @param magicOffset offset in the prefix where the magic bytes start
 */
public record Signature(String mimeType, byte[] magicBytes, int magicOffset) {

    public Signature {
        magicBytes = Arrays.copyOf(magicBytes, magicBytes.length);
    }

    public static Signature at0(String mimeType, int... magic) {
        byte[] bytes = new byte[magic.length];
        for (int i = 0; i < magic.length; i++) {
            bytes[i] = (byte) magic[i];
        }
        return new Signature(mimeType, bytes, 0);
    }

    public boolean matches(byte[] prefix, int length) {
        int end = magicOffset + magicBytes.length;
        if (prefix == null || length < end) {
            return false;
        }
        for (int i = 0; i < magicBytes.length; i++) {
            if (prefix[magicOffset + i] != magicBytes[i]) {
                return false;
            }
        }
        return true;
    }
}
