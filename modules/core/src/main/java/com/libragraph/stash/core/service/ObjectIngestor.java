package com.libragraph.stash.core.service;

import com.libragraph.stash.core.config.StashSettings;
import com.libragraph.stash.core.dao.NewStoredObject;
import com.libragraph.stash.core.storage.AtomicObjectWriter;
import com.libragraph.stash.core.storage.FilesystemObjectStore;
import com.libragraph.stash.core.storage.ObjectRejectedException;
import com.libragraph.stash.core.storage.WriteResult;
import com.libragraph.stash.types.ObjectKind;
import com.libragraph.stash.types.Visibility;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.InputStream;
import java.util.List;
import java.util.Locale;

/**
 * Admission checks and file staging shared by object and note operations.
 * Staged files are committed on disk but have no metadata row yet; callers
 * either record them or {@link #discardAll discard} them.
 */
@ApplicationScoped
public class ObjectIngestor {

    /** Width of the {@code logical_name} column. */
    public static final int MAX_LOGICAL_NAME = 255;

    private final StashSettings settings;
    private final FilesystemObjectStore store;
    private final AtomicObjectWriter writer;

    @Inject
    public ObjectIngestor(StashSettings settings, FilesystemObjectStore store, AtomicObjectWriter writer) {
        this.settings = settings;
        this.store = store;
        this.writer = writer;
    }

    /**
     * Cheap checks that need no bytes: extension allow-list and declared size.
     */
    public void validate(String filename, Long declaredSize) {
        String ext = extensionOf(filename);
        if (!settings.isExtensionAllowed(ext)) {
            throw new ObjectRejectedException(ObjectRejectedException.Reason.EXTENSION_NOT_ALLOWED,
                    "File extension not allowed: " + (ext.isEmpty() ? "(none)" : ext));
        }
        if (declaredSize != null && declaredSize > settings.maxObjectBytes()) {
            throw new ObjectRejectedException(ObjectRejectedException.Reason.TOO_LARGE,
                    "Declared size " + declaredSize + " exceeds " + settings.maxObjectBytes() + " bytes");
        }
    }

    public WriteResult stage(String filename, InputStream source) {
        String storageName = store.newStorageName(extensionOf(filename));
        return writer.write(source, store.root(), storageName);
    }

    /**
     * Stages server-generated content; the sniffed type is recorded but not gated.
     */
    public WriteResult stageGenerated(String filename, InputStream source) {
        String storageName = store.newStorageName(extensionOf(filename));
        return writer.write(source, store.root(), storageName, false);
    }

    public NewStoredObject toRow(long ownerId, String logicalName, WriteResult written,
                                 Visibility visibility, ObjectKind kind, Long groupingRef) {
        return new NewStoredObject(ownerId,
                logicalName,
                written.storageName(),
                written.size(),
                written.checksum().toHex(),
                written.contentType(),
                written.compressed(),
                written.encrypted(),
                written.nonceHex(),
                visibility,
                kind,
                groupingRef);
    }

    public void discard(WriteResult written) {
        store.discard(written.storageName());
    }

    public void discardAll(List<WriteResult> written) {
        written.forEach(this::discard);
    }

    /**
     * Lowercase extension after the last dot, empty if there is none.
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        String base = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
        int dot = base.lastIndexOf('.');
        if (dot <= 0 || dot == base.length() - 1) {
            return "";
        }
        return base.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Trimmed logical name. Blank names and names wider than the column are refused.
     */
    public static String requireLogicalName(String name) {
        return requireText(name, "Name", MAX_LOGICAL_NAME);
    }

    /**
     * Trimmed, non-blank text of at most {@code maxLength} characters.
     *
     * @throws ObjectRejectedException with {@link ObjectRejectedException.Reason#INVALID_INPUT}
     */
    public static String requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ObjectRejectedException(ObjectRejectedException.Reason.INVALID_INPUT,
                    field + " must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw new ObjectRejectedException(ObjectRejectedException.Reason.INVALID_INPUT,
                    field + " longer than " + maxLength + " characters");
        }
        return trimmed;
    }
}
