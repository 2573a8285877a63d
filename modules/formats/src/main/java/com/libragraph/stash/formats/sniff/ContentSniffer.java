package com.libragraph.stash.formats.sniff;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

/**
 * Detects a MIME type from the leading bytes of an object.
 *
 * <p>Known binary signatures win; otherwise the first {@value #TEXT_WINDOW}
 * bytes decide between {@code text/plain} and {@code application/octet-stream}.
 */
@ApplicationScoped
public class ContentSniffer {

    /** Largest prefix the sniffer looks at. */
    public static final int MAX_PREFIX = 512;

    static final int TEXT_WINDOW = 128;

    private static final List<Signature> SIGNATURES = List.of(
            Signature.at0("application/pdf", '%', 'P', 'D', 'F'),
            Signature.at0("image/png", 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A),
            Signature.at0("image/jpeg", 0xFF, 0xD8)
    );

    public SniffResult sniff(byte[] prefix) {
        return sniff(prefix, prefix == null ? 0 : prefix.length);
    }

    /**
     * Sniffs the first {@code length} bytes of {@code prefix}; bytes past
     * {@link #MAX_PREFIX} are ignored.
     */
    public SniffResult sniff(byte[] prefix, int length) {
        int usable = Math.min(length, MAX_PREFIX);
        for (Signature signature : SIGNATURES) {
            if (signature.matches(prefix, usable)) {
                return new SniffResult(signature.mimeType());
            }
        }
        return new SniffResult(looksLikeText(prefix, usable)
                ? SniffResult.TEXT_PLAIN
                : SniffResult.OCTET_STREAM);
    }

    private static boolean looksLikeText(byte[] prefix, int length) {
        int scanned = Math.min(length, TEXT_WINDOW);
        for (int i = 0; i < scanned; i++) {
            int b = prefix[i] & 0xFF;
            if (b == '\t' || b == '\n' || b == '\r') {
                continue;
            }
            if (b < 32 || b > 126) {
                return false;
            }
        }
        return true;
    }
}
