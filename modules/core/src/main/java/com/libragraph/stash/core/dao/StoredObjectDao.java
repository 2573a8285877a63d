package com.libragraph.stash.core.dao;

import com.libragraph.stash.types.Visibility;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(VisibilityColumnMapper.class)
@RegisterColumnMapper(ObjectKindColumnMapper.class)
@RegisterArgumentFactory(VisibilityArgumentFactory.class)
@RegisterArgumentFactory(ObjectKindArgumentFactory.class)
@RegisterConstructorMapper(StoredObjectRecord.class)
public interface StoredObjectDao {

    @SqlUpdate("INSERT INTO stored_object (owner_id, logical_name, storage_name, size_bytes, " +
            "checksum_sha256, content_type, is_compressed, is_encrypted, encryption_nonce_hex, " +
            "visibility, kind, grouping_ref) " +
            "VALUES (:ownerId, :logicalName, :storageName, :size, :checksumSha256, :contentType, " +
            ":compressed, :encrypted, :encryptionNonceHex, :visibility, :kind, :groupingRef)")
    @GetGeneratedKeys("id")
    long insert(@BindMethods NewStoredObject object);

    @SqlQuery("SELECT * FROM stored_object WHERE id = :id")
    Optional<StoredObjectRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM stored_object WHERE owner_id = :ownerId ORDER BY uploaded_at DESC, id DESC")
    List<StoredObjectRecord> findByOwner(@Bind("ownerId") long ownerId);

    /**
     * Objects of {@code ownerId} grouped under a note. Rows of other owners
     * are never part of the group.
     */
    @SqlQuery("SELECT * FROM stored_object WHERE grouping_ref = :groupingRef AND owner_id = :ownerId ORDER BY id")
    List<StoredObjectRecord> findByGroupingRef(@Bind("groupingRef") long groupingRef,
                                               @Bind("ownerId") long ownerId);

    @SqlQuery("SELECT COALESCE(SUM(size_bytes), 0) FROM stored_object WHERE owner_id = :ownerId")
    long sumRecordedSize(@Bind("ownerId") long ownerId);

    /**
     * Storage names of legacy rows that never recorded a size.
     */
    @SqlQuery("SELECT storage_name FROM stored_object WHERE owner_id = :ownerId AND size_bytes IS NULL")
    List<String> findUnsizedStorageNames(@Bind("ownerId") long ownerId);

    @SqlUpdate("UPDATE stored_object SET logical_name = :logicalName WHERE id = :id")
    int updateLogicalName(@Bind("id") long id, @Bind("logicalName") String logicalName);

    @SqlUpdate("UPDATE stored_object SET visibility = :visibility " +
            "WHERE grouping_ref = :groupingRef AND owner_id = :ownerId")
    int updateVisibilityByGroupingRef(@Bind("groupingRef") long groupingRef,
                                      @Bind("ownerId") long ownerId,
                                      @Bind("visibility") Visibility visibility);

    @SqlUpdate("DELETE FROM stored_object WHERE id = :id")
    int delete(@Bind("id") long id);

    @SqlUpdate("DELETE FROM stored_object WHERE grouping_ref = :groupingRef AND owner_id = :ownerId")
    int deleteByGroupingRef(@Bind("groupingRef") long groupingRef, @Bind("ownerId") long ownerId);
}
