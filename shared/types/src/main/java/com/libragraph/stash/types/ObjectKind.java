package com.libragraph.stash.types;

/**
 * Role of a stored object: a standalone upload, the markdown body of a note,
 * or a file attached to a note.
 */
public enum ObjectKind {
    FILE(0, "file"),
    CONTENT(1, "content"),
    ATTACHMENT(2, "attachment");

    private final int id;
    private final String label;

    ObjectKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static ObjectKind fromId(int id) {
        for (ObjectKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown ObjectKind id: " + id);
    }
}
