package com.libragraph.stash.types;

import java.util.Locale;

public enum Visibility {
    PRIVATE(0, "private"),
    PUBLIC(1, "public"),
    UNLISTED(2, "unlisted");

    private final int id;
    private final String label;

    Visibility(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static Visibility fromId(int id) {
        for (Visibility v : values()) {
            if (v.id == id) return v;
        }
        throw new IllegalArgumentException("Unknown Visibility id: " + id);
    }

    /**
     * Parses a caller-supplied label. Anything unrecognized, including null,
     * falls back to {@link #PRIVATE}.
     */
    public static Visibility parseOrPrivate(String label) {
        if (label == null) {
            return PRIVATE;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Visibility v : values()) {
            if (v.label.equals(normalized)) return v;
        }
        return PRIVATE;
    }
}
