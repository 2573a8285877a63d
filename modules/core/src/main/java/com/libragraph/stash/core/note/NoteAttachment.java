package com.libragraph.stash.core.note;

import java.io.InputStream;

/**
 * A file to store alongside a note; {@code source} is consumed once.
 */
public record NoteAttachment(String filename, InputStream source) {}
