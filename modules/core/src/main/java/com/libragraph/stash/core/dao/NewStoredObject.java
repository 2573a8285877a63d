package com.libragraph.stash.core.dao;

import com.libragraph.stash.types.ObjectKind;
import com.libragraph.stash.types.Visibility;

/**
 * Insert parameters for {@link StoredObjectDao#insert}; bound by accessor name.
 */
public record NewStoredObject(
        long ownerId,
        String logicalName,
        String storageName,
        Long size,
        String checksumSha256,
        String contentType,
        Boolean compressed,
        Boolean encrypted,
        String encryptionNonceHex,
        Visibility visibility,
        ObjectKind kind,
        Long groupingRef
) {}
