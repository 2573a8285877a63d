package com.libragraph.stash.core.db;

import com.libragraph.stash.core.storage.StorageException;
import org.jdbi.v3.core.HandleCallback;
import org.jdbi.v3.core.HandleConsumer;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

/**
 * Runs the metadata side of a write in one transaction. Database failures
 * surface as {@link StorageException}; any other exception passes through
 * unchanged.
 */
public final class MetadataTransactions {

    private MetadataTransactions() {
    }

    public static <T> T inTransaction(Jdbi jdbi, HandleCallback<T, RuntimeException> callback) {
        try {
            return jdbi.inTransaction(callback);
        } catch (JdbiException e) {
            throw new StorageException("Failed to record metadata", e);
        }
    }

    public static void useTransaction(Jdbi jdbi, HandleConsumer<RuntimeException> consumer) {
        try {
            jdbi.useTransaction(consumer);
        } catch (JdbiException e) {
            throw new StorageException("Failed to record metadata", e);
        }
    }
}
