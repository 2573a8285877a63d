package com.libragraph.stash.core.service;

import com.libragraph.stash.core.access.AccessDeniedException;
import com.libragraph.stash.core.access.AccessPolicy;
import com.libragraph.stash.core.dao.NoteDao;
import com.libragraph.stash.core.dao.NoteRecord;
import com.libragraph.stash.core.dao.StoredObjectDao;
import com.libragraph.stash.core.dao.StoredObjectRecord;
import com.libragraph.stash.core.db.MetadataTransactions;
import com.libragraph.stash.core.note.NoteNotFoundException;
import com.libragraph.stash.core.quota.OwnerLocks;
import com.libragraph.stash.core.quota.QuotaLedger;
import com.libragraph.stash.core.storage.FilesystemObjectStore;
import com.libragraph.stash.core.storage.ObjectContent;
import com.libragraph.stash.core.storage.ObjectNotFoundException;
import com.libragraph.stash.core.storage.ObjectReader;
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

/**
 * Upload, download and housekeeping of individual stored objects.
 *
 * <p>Uploads for one owner are admitted one at a time: the quota pre-check,
 * the file write, the quota post-check and the metadata insert all run in
 * that owner's critical section.
 */
@ApplicationScoped
public class ObjectService {

    private static final Logger log = Logger.getLogger(ObjectService.class);

    private final Jdbi jdbi;
    private final ObjectIngestor ingestor;
    private final ObjectReader reader;
    private final FilesystemObjectStore store;
    private final QuotaLedger quota;
    private final OwnerLocks locks;
    private final AccessPolicy access;

    @Inject
    public ObjectService(Jdbi jdbi, ObjectIngestor ingestor, ObjectReader reader,
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

    public Uni<StoredObjectRecord> upload(UploadRequest request) {
        return Uni.createFrom().item(() -> store(request));
    }

    StoredObjectRecord store(UploadRequest request) {
        String logicalName = ObjectIngestor.requireLogicalName(request.filename());
        ingestor.validate(logicalName, request.declaredSize());
        Visibility visibility = Visibility.parseOrPrivate(request.visibility());
        ObjectKind kind = request.kind() != null ? request.kind() : ObjectKind.FILE;

        return locks.withLock(request.ownerId(), () -> {
            quota.precheck(request.ownerId());
            WriteResult written = ingestor.stage(logicalName, request.source());
            try {
                quota.postcheck(request.ownerId(), written.size());
                StoredObjectRecord record = MetadataTransactions.inTransaction(jdbi, h -> {
                    if (request.groupingRef() != null) {
                        requireOwnNote(h, request.ownerId(), request.groupingRef());
                    }
                    StoredObjectDao dao = h.attach(StoredObjectDao.class);
                    long id = dao.insert(ingestor.toRow(request.ownerId(), logicalName, written,
                            visibility, kind, request.groupingRef()));
                    return dao.findById(id).orElseThrow(() -> new ObjectNotFoundException(id));
                });
                log.infof("Stored object %d for owner %d: %s (%d bytes)",
                        record.id(), record.ownerId(), logicalName, written.size());
                return record;
            } catch (RuntimeException e) {
                ingestor.discard(written);
                throw e;
            }
        });
    }

    /**
     * Authorizes, reads and verifies an object. The caller closes the returned download.
     */
    public Uni<Download> download(long objectId, long callerId) {
        return Uni.createFrom().item(() -> {
            StoredObjectRecord object = find(objectId);
            access.requireRead(callerId, object);
            ObjectContent content = reader.read(object);
            return new Download(object, content);
        });
    }

    public Uni<Void> delete(long objectId, long callerId) {
        return Uni.createFrom().voidItem().invoke(() -> {
            StoredObjectRecord object = find(objectId);
            access.requireMutation(callerId, object);
            locks.withLock(object.ownerId(), () -> {
                MetadataTransactions.useTransaction(jdbi, h -> h.attach(StoredObjectDao.class).delete(objectId));
                store.discard(object.storageName());
                return null;
            });
            log.infof("Deleted object %d", objectId);
        });
    }

    /**
     * Changes the logical name only; stored bytes and their description stay as written.
     */
    public Uni<StoredObjectRecord> rename(long objectId, long callerId, String newName) {
        return Uni.createFrom().item(() -> {
            String logicalName = ObjectIngestor.requireLogicalName(newName);
            StoredObjectRecord object = find(objectId);
            access.requireMutation(callerId, object);
            ingestor.validate(logicalName, null);
            return MetadataTransactions.inTransaction(jdbi, h -> {
                StoredObjectDao dao = h.attach(StoredObjectDao.class);
                dao.updateLogicalName(objectId, logicalName);
                return dao.findById(objectId).orElseThrow(() -> new ObjectNotFoundException(objectId));
            });
        });
    }

    public Multi<StoredObjectRecord> list(long ownerId) {
        return Multi.createFrom().items(() -> jdbi.withHandle(h ->
                h.attach(StoredObjectDao.class).findByOwner(ownerId)).stream());
    }

    public Uni<Long> usage(long ownerId) {
        return Uni.createFrom().item(() -> quota.usage(ownerId));
    }

    /**
     * An object may only join a note its uploader owns.
     */
    private static void requireOwnNote(Handle h, long ownerId, long noteId) {
        NoteRecord note = h.attach(NoteDao.class).findById(noteId)
                .orElseThrow(() -> new NoteNotFoundException(noteId));
        if (note.ownerId() != ownerId) {
            throw new AccessDeniedException(ownerId, "note " + noteId);
        }
    }

    private StoredObjectRecord find(long objectId) {
        return jdbi.withHandle(h -> h.attach(StoredObjectDao.class).findById(objectId))
                .orElseThrow(() -> new ObjectNotFoundException(objectId));
    }
}
