package com.libragraph.stash.core.note;

import com.libragraph.stash.core.access.AccessPolicy;
import com.libragraph.stash.core.dao.NoteDao;
import com.libragraph.stash.core.dao.NoteRecord;
import com.libragraph.stash.core.dao.NoteTagDao;
import com.libragraph.stash.core.dao.StoredObjectDao;
import com.libragraph.stash.core.dao.StoredObjectRecord;
import com.libragraph.stash.core.db.MetadataTransactions;
import com.libragraph.stash.core.quota.OwnerLocks;
import com.libragraph.stash.core.quota.QuotaLedger;
import com.libragraph.stash.core.service.ObjectIngestor;
import com.libragraph.stash.core.storage.FilesystemObjectStore;
import com.libragraph.stash.core.storage.ObjectRejectedException;
import com.libragraph.stash.core.storage.ObjectContent;
import com.libragraph.stash.core.storage.ObjectReader;
import com.libragraph.stash.core.storage.StorageException;
import com.libragraph.stash.core.storage.WriteResult;
import com.libragraph.stash.types.ObjectKind;
import com.libragraph.stash.types.Visibility;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Notes: a markdown body stored as an object, tags, and attachments grouped
 * under the note id.
 *
 * <p>Every operation that writes files does so inside the owner's critical
 * section and records all rows in one transaction; on failure every file
 * written so far is removed.
 */
@ApplicationScoped
public class NoteService {

    private static final Logger log = Logger.getLogger(NoteService.class);

    static final String CONTENT_SUFFIX = ".md";
    /** Leaves room for the body's {@code <title>.md} name. */
    static final int MAX_TITLE = ObjectIngestor.MAX_LOGICAL_NAME - CONTENT_SUFFIX.length();
    static final int MAX_SUBJECT = 255;
    static final int MAX_PAGE = 100;

    private final Jdbi jdbi;
    private final ObjectIngestor ingestor;
    private final ObjectReader reader;
    private final FilesystemObjectStore store;
    private final QuotaLedger quota;
    private final OwnerLocks locks;
    private final AccessPolicy access;

    @Inject
    public NoteService(Jdbi jdbi, ObjectIngestor ingestor, ObjectReader reader,
                       FilesystemObjectStore store, QuotaLedger quota,
                       OwnerLocks locks, AccessPolicy access) {
        this.jdbi = jdbi;
        this.ingestor = ingestor;
        this.reader = reader;
        this.store = store;
        this.quota = quota;
        this.locks = locks;
        this.access = access;
    }

    private record Staged(String logicalName, ObjectKind kind, WriteResult written) {}

    public Uni<NoteView> create(long ownerId, NoteDraft draft) {
        return Uni.createFrom().item(() -> {
            String title = requireTitle(draft.title());
            String subject = checkSubject(draft.subject());
            String contentName = contentName(title);
            Visibility visibility = Visibility.parseOrPrivate(draft.visibility());
            List<String> tags = NoteTags.normalize(draft.tags());
            draft.attachments().forEach(a -> ingestor.validate(ObjectIngestor.requireLogicalName(a.filename()), null));

            long noteId = locks.withLock(ownerId, () -> {
                quota.precheck(ownerId);
                List<Staged> staged = new ArrayList<>();
                try {
                    staged.add(stageContent(contentName, draft.content()));
                    stageAttachments(draft.attachments(), staged);
                    quota.postcheck(ownerId, totalSize(staged));
                    return MetadataTransactions.inTransaction(jdbi, h -> {
                        long id = h.attach(NoteDao.class).insert(ownerId, title, subject, visibility);
                        if (!tags.isEmpty()) {
                            h.attach(NoteTagDao.class).insertAll(id, tags);
                        }
                        recordAll(h, ownerId, id, visibility, staged);
                        return id;
                    });
                } catch (RuntimeException e) {
                    discardAll(staged);
                    throw e;
                }
            });
            log.infof("Created note %d for owner %d", noteId, ownerId);
            return view(find(noteId));
        });
    }

    public Uni<NoteView> get(long noteId, long callerId) {
        return Uni.createFrom().item(() -> {
            NoteRecord note = find(noteId);
            access.requireRead(callerId, note);
            return view(note);
        });
    }

    /**
     * Markdown body, read and verified like any other object. Empty when the note has none.
     */
    public Uni<String> readContent(long noteId, long callerId) {
        return Uni.createFrom().item(() -> {
            NoteRecord note = find(noteId);
            access.requireRead(callerId, note);
            Optional<StoredObjectRecord> content = objects(note).stream()
                    .filter(o -> o.kind() == ObjectKind.CONTENT)
                    .findFirst();
            if (content.isEmpty()) {
                return "";
            }
            try (ObjectContent body = reader.read(content.get())) {
                return new String(body.bytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new StorageException("Failed to release content of note " + noteId, e);
            }
        });
    }

    public Uni<NoteView> update(long noteId, long callerId, NoteUpdate update) {
        return Uni.createFrom().item(() -> {
            NoteRecord note = find(noteId);
            access.requireMutation(callerId, note);
            long ownerId = note.ownerId();
            String title = update.title() != null ? requireTitle(update.title()) : note.title();
            String subject = update.subject() != null ? checkSubject(update.subject()) : note.subject();
            String contentName = contentName(title);
            Visibility visibility = update.visibility() != null
                    ? Visibility.parseOrPrivate(update.visibility())
                    : note.visibility();
            List<String> tags = update.tags() != null ? NoteTags.normalize(update.tags()) : null;
            update.attachments().forEach(a -> ingestor.validate(ObjectIngestor.requireLogicalName(a.filename()), null));

            Optional<StoredObjectRecord> replaced = locks.withLock(ownerId, () -> {
                Optional<StoredObjectRecord> currentContent = objects(note).stream()
                        .filter(o -> o.kind() == ObjectKind.CONTENT)
                        .findFirst();
                Optional<StoredObjectRecord> oldContent = update.content() == null
                        ? Optional.empty()
                        : currentContent;
                List<Staged> staged = new ArrayList<>();
                try {
                    if (update.content() != null || !update.attachments().isEmpty()) {
                        quota.precheck(ownerId);
                        if (update.content() != null) {
                            staged.add(stageContent(contentName, update.content()));
                        }
                        stageAttachments(update.attachments(), staged);
                        long freed = oldContent.map(o -> o.size() != null ? o.size() : 0L).orElse(0L);
                        quota.postcheck(ownerId, totalSize(staged) - freed);
                    }
                    MetadataTransactions.useTransaction(jdbi, h -> {
                        h.attach(NoteDao.class).update(noteId, title, subject, visibility);
                        if (tags != null) {
                            NoteTagDao tagDao = h.attach(NoteTagDao.class);
                            tagDao.deleteByNote(noteId);
                            if (!tags.isEmpty()) {
                                tagDao.insertAll(noteId, tags);
                            }
                        }
                        recordAll(h, ownerId, noteId, visibility, staged);
                        StoredObjectDao objectDao = h.attach(StoredObjectDao.class);
                        if (oldContent.isPresent()) {
                            objectDao.delete(oldContent.get().id());
                        } else {
                            currentContent.filter(o -> !o.logicalName().equals(contentName))
                                    .ifPresent(o -> objectDao.updateLogicalName(o.id(), contentName));
                        }
                        objectDao.updateVisibilityByGroupingRef(noteId, ownerId, visibility);
                    });
                    return oldContent;
                } catch (RuntimeException e) {
                    discardAll(staged);
                    throw e;
                }
            });
            replaced.ifPresent(o -> store.discard(o.storageName()));
            log.debugf("Updated note %d", noteId);
            return view(find(noteId));
        });
    }

    public Uni<Void> delete(long noteId, long callerId) {
        return Uni.createFrom().voidItem().invoke(() -> {
            NoteRecord note = find(noteId);
            access.requireMutation(callerId, note);
            long ownerId = note.ownerId();
            List<StoredObjectRecord> removed = locks.withLock(ownerId, () ->
                    MetadataTransactions.inTransaction(jdbi, h -> {
                        StoredObjectDao objectDao = h.attach(StoredObjectDao.class);
                        List<StoredObjectRecord> objects = objectDao.findByGroupingRef(noteId, ownerId);
                        h.attach(NoteTagDao.class).deleteByNote(noteId);
                        objectDao.deleteByGroupingRef(noteId, ownerId);
                        h.attach(NoteDao.class).delete(noteId);
                        return objects;
                    }));
            removed.forEach(o -> store.discard(o.storageName()));
            log.infof("Deleted note %d with %d object(s)", noteId, removed.size());
        });
    }

    /**
     * Owner's notes, newest first, optionally restricted to one visibility.
     */
    public Multi<NoteRecord> list(long ownerId, Visibility filter, int limit, int offset) {
        int size = pageSize(limit);
        int skip = Math.max(0, offset);
        return Multi.createFrom().items(() -> jdbi.withHandle(h -> {
            NoteDao dao = h.attach(NoteDao.class);
            return filter == null
                    ? dao.findByOwner(ownerId, size, skip)
                    : dao.findByOwnerAndVisibility(ownerId, filter, size, skip);
        }).stream());
    }

    /**
     * Public notes whose title or a tag contains {@code query}, ignoring case.
     */
    public Multi<NoteRecord> searchPublic(String query, int limit, int offset) {
        if (query == null || query.isBlank()) {
            return Multi.createFrom().empty();
        }
        String pattern = "%" + escapeLike(query.trim().toLowerCase(Locale.ROOT)) + "%";
        int size = pageSize(limit);
        int skip = Math.max(0, offset);
        return Multi.createFrom().items(() -> jdbi.withHandle(h ->
                h.attach(NoteDao.class).search(Visibility.PUBLIC, pattern, size, skip)).stream());
    }

    private Staged stageContent(String name, String markdown) {
        byte[] body = (markdown == null ? "" : markdown).getBytes(StandardCharsets.UTF_8);
        WriteResult written = ingestor.stageGenerated(name, new ByteArrayInputStream(body));
        return new Staged(name, ObjectKind.CONTENT, written);
    }

    private void stageAttachments(List<NoteAttachment> attachments, List<Staged> staged) {
        for (NoteAttachment attachment : attachments) {
            String name = ObjectIngestor.requireLogicalName(attachment.filename());
            staged.add(new Staged(name, ObjectKind.ATTACHMENT, ingestor.stage(name, attachment.source())));
        }
    }

    private void recordAll(Handle h, long ownerId, long noteId, Visibility visibility, List<Staged> staged) {
        StoredObjectDao dao = h.attach(StoredObjectDao.class);
        for (Staged s : staged) {
            dao.insert(ingestor.toRow(ownerId, s.logicalName(), s.written(), visibility, s.kind(), noteId));
        }
    }

    private void discardAll(List<Staged> staged) {
        ingestor.discardAll(staged.stream().map(Staged::written).toList());
    }

    private static long totalSize(List<Staged> staged) {
        return staged.stream().mapToLong(s -> s.written().size()).sum();
    }

    private NoteView view(NoteRecord note) {
        return jdbi.withHandle(h -> {
            List<String> tags = h.attach(NoteTagDao.class).findByNote(note.id());
            Long contentId = null;
            List<NoteView.AttachmentSummary> attachments = new ArrayList<>();
            for (StoredObjectRecord o : h.attach(StoredObjectDao.class).findByGroupingRef(note.id(), note.ownerId())) {
                if (o.kind() == ObjectKind.CONTENT) {
                    contentId = o.id();
                } else {
                    attachments.add(new NoteView.AttachmentSummary(o.id(), o.logicalName(),
                            o.contentType(), o.size()));
                }
            }
            return new NoteView(note, tags, contentId, attachments);
        });
    }

    private NoteRecord find(long noteId) {
        return jdbi.withHandle(h -> h.attach(NoteDao.class).findById(noteId))
                .orElseThrow(() -> new NoteNotFoundException(noteId));
    }

    private List<StoredObjectRecord> objects(NoteRecord note) {
        return jdbi.withHandle(h -> h.attach(StoredObjectDao.class).findByGroupingRef(note.id(), note.ownerId()));
    }

    private static String requireTitle(String title) {
        return ObjectIngestor.requireText(title, "Note title", MAX_TITLE);
    }

    private static String checkSubject(String subject) {
        if (subject != null && subject.length() > MAX_SUBJECT) {
            throw new ObjectRejectedException(ObjectRejectedException.Reason.INVALID_INPUT,
                    "Note subject longer than " + MAX_SUBJECT + " characters");
        }
        return subject;
    }

    /**
     * The markdown body is stored under the note's title.
     */
    static String contentName(String title) {
        return ObjectIngestor.requireLogicalName(title + CONTENT_SUFFIX);
    }

    private static int pageSize(int limit) {
        return Math.max(1, Math.min(limit, MAX_PAGE));
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
