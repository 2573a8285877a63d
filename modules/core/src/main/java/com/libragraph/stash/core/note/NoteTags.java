package com.libragraph.stash.core.note;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

final class NoteTags {

    static final int MAX_TAG_LENGTH = 50;

    private NoteTags() {
    }

    /**
     * Trims, drops empties, truncates to {@value #MAX_TAG_LENGTH} characters
     * and removes duplicates, keeping first-seen order.
     */
    static List<String> normalize(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> tags = new LinkedHashSet<>();
        for (String tag : raw) {
            if (tag == null) {
                continue;
            }
            String trimmed = tag.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            tags.add(trimmed.length() > MAX_TAG_LENGTH ? trimmed.substring(0, MAX_TAG_LENGTH).trim() : trimmed);
        }
        return new ArrayList<>(tags);
    }
}
