package com.libragraph.stash.core.dao;

import com.libragraph.stash.types.Visibility;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record NoteRecord(
        @ColumnName("id") long id,
        @ColumnName("owner_id") long ownerId,
        @ColumnName("title") String title,
        @ColumnName("subject") String subject,
        @ColumnName("visibility") Visibility visibility,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt
) {}
