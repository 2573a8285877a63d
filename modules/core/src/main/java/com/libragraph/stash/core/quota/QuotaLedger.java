package com.libragraph.stash.core.quota;

import com.libragraph.stash.core.config.StashSettings;
import com.libragraph.stash.core.dao.StoredObjectDao;
import com.libragraph.stash.core.storage.FilesystemObjectStore;
import com.libragraph.stash.core.storage.ObjectRejectedException;
import com.libragraph.stash.core.storage.StorageException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

/**
 * Per-owner storage accounting. Checks must run inside the owner's
 * {@link OwnerLocks} section to be meaningful.
 */
@ApplicationScoped
public class QuotaLedger {

    private static final Logger log = Logger.getLogger(QuotaLedger.class);

    private final Jdbi jdbi;
    private final FilesystemObjectStore store;
    private final long maxOwnerBytes;

    @Inject
    public QuotaLedger(Jdbi jdbi, FilesystemObjectStore store, StashSettings settings) {
        this.jdbi = jdbi;
        this.store = store;
        this.maxOwnerBytes = settings.maxOwnerBytes();
    }

    /**
     * Total bytes held by the owner. Rows without a recorded size count
     * their on-disk size; a missing file counts as zero.
     */
    public long usage(long ownerId) {
        try {
            return jdbi.withHandle(h -> {
                StoredObjectDao dao = h.attach(StoredObjectDao.class);
                long total = dao.sumRecordedSize(ownerId);
                for (String storageName : dao.findUnsizedStorageNames(ownerId)) {
                    total += store.sizeOnDisk(storageName);
                }
                return total;
            });
        } catch (JdbiException e) {
            throw new StorageException("Failed to compute usage of owner " + ownerId, e);
        }
    }

    /**
     * Rejects up front when the owner is already at or over the cap.
     */
    public void precheck(long ownerId) {
        long used = usage(ownerId);
        if (used >= maxOwnerBytes) {
            log.debugf("Quota precheck failed for owner %d: %d/%d", ownerId, used, maxOwnerBytes);
            throw new ObjectRejectedException(ObjectRejectedException.Reason.QUOTA_EXCEEDED,
                    "Storage quota of " + maxOwnerBytes + " bytes reached");
        }
    }

    /**
     * Rejects when the freshly written, not yet recorded bytes push the owner over the cap.
     * The caller removes the files it wrote.
     */
    public void postcheck(long ownerId, long addedBytes) {
        long used = usage(ownerId);
        if (used + addedBytes > maxOwnerBytes) {
            log.debugf("Quota postcheck failed for owner %d: %d+%d > %d",
                    ownerId, used, addedBytes, maxOwnerBytes);
            throw new ObjectRejectedException(ObjectRejectedException.Reason.QUOTA_EXCEEDED,
                    "Upload would exceed storage quota of " + maxOwnerBytes + " bytes");
        }
    }
}
