package com.libragraph.stash.core.note;

import com.libragraph.stash.core.dao.NoteRecord;

import java.util.List;

/**
 * A note with its tags and the objects grouped under it.
 */
public record NoteView(
        NoteRecord note,
        List<String> tags,
        Long contentObjectId,
        List<AttachmentSummary> attachments
) {

    public record AttachmentSummary(long objectId, String logicalName, String contentType, Long size) {}
}
