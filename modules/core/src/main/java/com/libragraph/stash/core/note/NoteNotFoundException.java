package com.libragraph.stash.core.note;

public class NoteNotFoundException extends RuntimeException {

    private final long noteId;

    public NoteNotFoundException(long noteId) {
        super("Note not found: " + noteId);
        this.noteId = noteId;
    }

    public long noteId() {
        return noteId;
    }
}
