package com.libragraph.stash.core.service;

import com.libragraph.stash.types.ObjectKind;

import java.io.InputStream;

/**
 * A single object upload.
 *
 * @param ownerId      authenticated uploader
 * @param filename     client-supplied logical name, kept only as metadata
 * @param declaredSize client-declared byte count, null when unknown
 * @param visibility   visibility label; unknown values mean private
 * @param groupingRef  id of the note the object belongs to, or null
 * @param kind         role of the object
 * @param source       the bytes; consumed once, not closed
 */
public record UploadRequest(
        long ownerId,
        String filename,
        Long declaredSize,
        String visibility,
        Long groupingRef,
        ObjectKind kind,
        InputStream source
) {

    public static UploadRequest of(long ownerId, String filename, InputStream source) {
        return new UploadRequest(ownerId, filename, null, null, null, ObjectKind.FILE, source);
    }

    public UploadRequest withVisibility(String label) {
        return new UploadRequest(ownerId, filename, declaredSize, label, groupingRef, kind, source);
    }

    public UploadRequest withDeclaredSize(Long size) {
        return new UploadRequest(ownerId, filename, size, visibility, groupingRef, kind, source);
    }
}
