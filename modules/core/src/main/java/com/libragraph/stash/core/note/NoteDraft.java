package com.libragraph.stash.core.note;

import java.util.List;

/**
 * Input for a new note.
 *
 * @param title       required
 * @param subject     optional free text
 * @param visibility  visibility label; unknown values mean private
 * @param content     markdown body, stored as an object
 * @param tags        raw tags, normalized on save
 * @param attachments files stored with the note
 */
public record NoteDraft(
        String title,
        String subject,
        String visibility,
        String content,
        List<String> tags,
        List<NoteAttachment> attachments
) {

    public NoteDraft {
        tags = tags == null ? List.of() : List.copyOf(tags);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}
