package com.libragraph.stash.core.service;

import com.libragraph.stash.core.dao.StoredObjectRecord;
import com.libragraph.stash.core.storage.ObjectContent;

import java.io.Closeable;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verified object content plus the response headers a transport should send.
 */
public record Download(StoredObjectRecord object, ObjectContent content) implements Closeable {

    public static final String CONTENT_DISPOSITION = "Content-Disposition";
    public static final String CHECKSUM = "X-Checksum-SHA256";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CONTENT_LENGTH = "Content-Length";

    private static final String DEFAULT_TYPE = "application/octet-stream";

    public Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(CONTENT_DISPOSITION, "attachment; filename=\"" + quoteSafe(object.logicalName()) + "\"");
        headers.put(CHECKSUM, object.checksumSha256() != null
                ? object.checksumSha256()
                : content.checksum().toHex());
        headers.put(CONTENT_TYPE, object.contentType() != null ? object.contentType() : DEFAULT_TYPE);
        headers.put(CONTENT_LENGTH, Long.toString(content.size()));
        return headers;
    }

    @Override
    public void close() throws IOException {
        content.close();
    }

    static String quoteSafe(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            sb.append(c == '"' || c == '\\' || c < 0x20 || c == 0x7F ? '_' : c);
        }
        return sb.toString();
    }
}
