package com.libragraph.stash.formats.sniff;

import java.util.Collection;

/**
 * Outcome of content sniffing. Advisory only: it is never a security boundary.
 */
public record SniffResult(String mimeType) {

    public static final String OCTET_STREAM = "application/octet-stream";
    public static final String TEXT_PLAIN = "text/plain";

    public boolean isImage() {
        return mimeType.startsWith("image/");
    }

    public boolean isText() {
        return mimeType.startsWith("text/");
    }

    /**
     * True when the MIME type starts with any of the given prefixes.
     */
    public boolean matchesAny(Collection<String> prefixes) {
        for (String prefix : prefixes) {
            if (mimeType.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
