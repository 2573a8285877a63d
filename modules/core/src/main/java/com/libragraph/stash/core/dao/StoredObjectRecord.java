package com.libragraph.stash.core.dao;

import com.libragraph.stash.types.ObjectKind;
import com.libragraph.stash.types.Visibility;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/**
 * Metadata row of a stored object. {@code compressed}, {@code encrypted} and
 * {@code size} are null only on rows written before those columns existed.
 */
public record StoredObjectRecord(
        @ColumnName("id") long id,
        @ColumnName("owner_id") long ownerId,
        @ColumnName("logical_name") String logicalName,
        @ColumnName("storage_name") String storageName,
        @ColumnName("size_bytes") Long size,
        @ColumnName("checksum_sha256") String checksumSha256,
        @ColumnName("content_type") String contentType,
        @ColumnName("is_compressed") Boolean compressed,
        @ColumnName("is_encrypted") Boolean encrypted,
        @ColumnName("encryption_nonce_hex") String encryptionNonceHex,
        @ColumnName("visibility") Visibility visibility,
        @ColumnName("kind") ObjectKind kind,
        @ColumnName("grouping_ref") Long groupingRef,
        @ColumnName("uploaded_at") Instant uploadedAt
) {}
