/**
 * Shared utilities for all Stash modules.
 *
 * <p>Contains {@link com.libragraph.stash.util.ContentHash} (SHA-256) and the
 * {@link com.libragraph.stash.util.buffer buffer layer} (BinaryData, Buffer, RamBuffer, FileBuffer).
 * No framework dependencies; Commons Codec supplies the digest.
 */
package com.libragraph.stash.util;
