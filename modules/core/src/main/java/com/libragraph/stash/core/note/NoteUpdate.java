package com.libragraph.stash.core.note;

import java.util.List;

/**
 * Changes to a note. Null fields are left as they are; {@code tags}, when
 * given, replace the current tags; {@code attachments} are added.
 */
public record NoteUpdate(
        String title,
        String subject,
        String visibility,
        String content,
        List<String> tags,
        List<NoteAttachment> attachments
) {

    public NoteUpdate {
        tags = tags == null ? null : List.copyOf(tags);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public static NoteUpdate content(String content) {
        return new NoteUpdate(null, null, null, content, null, null);
    }
}
