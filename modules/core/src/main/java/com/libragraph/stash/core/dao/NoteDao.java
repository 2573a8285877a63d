package com.libragraph.stash.core.dao;

import com.libragraph.stash.types.Visibility;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(VisibilityColumnMapper.class)
@RegisterArgumentFactory(VisibilityArgumentFactory.class)
@RegisterConstructorMapper(NoteRecord.class)
public interface NoteDao {

    @SqlUpdate("INSERT INTO note (owner_id, title, subject, visibility) " +
            "VALUES (:ownerId, :title, :subject, :visibility)")
    @GetGeneratedKeys("id")
    long insert(@Bind("ownerId") long ownerId,
                @Bind("title") String title,
                @Bind("subject") String subject,
                @Bind("visibility") Visibility visibility);

    @SqlQuery("SELECT * FROM note WHERE id = :id")
    Optional<NoteRecord> findById(@Bind("id") long id);

    @SqlUpdate("UPDATE note SET title = :title, subject = :subject, visibility = :visibility, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = :id")
    int update(@Bind("id") long id,
               @Bind("title") String title,
               @Bind("subject") String subject,
               @Bind("visibility") Visibility visibility);

    @SqlUpdate("DELETE FROM note WHERE id = :id")
    int delete(@Bind("id") long id);

    @SqlQuery("SELECT * FROM note WHERE owner_id = :ownerId " +
            "ORDER BY updated_at DESC, id DESC LIMIT :limit OFFSET :offset")
    List<NoteRecord> findByOwner(@Bind("ownerId") long ownerId,
                                 @Bind("limit") int limit,
                                 @Bind("offset") int offset);

    @SqlQuery("SELECT * FROM note WHERE owner_id = :ownerId AND visibility = :visibility " +
            "ORDER BY updated_at DESC, id DESC LIMIT :limit OFFSET :offset")
    List<NoteRecord> findByOwnerAndVisibility(@Bind("ownerId") long ownerId,
                                              @Bind("visibility") Visibility visibility,
                                              @Bind("limit") int limit,
                                              @Bind("offset") int offset);

    /**
     * Case-insensitive match of {@code pattern} (a LIKE pattern, lowercase,
     * backslash-escaped) against title or any tag.
     */
    @SqlQuery("SELECT n.* FROM note n WHERE n.visibility = :visibility AND (" +
            "LOWER(n.title) LIKE :pattern ESCAPE '\\' " +
            "OR EXISTS (SELECT 1 FROM note_tag t WHERE t.note_id = n.id " +
            "AND LOWER(t.tag) LIKE :pattern ESCAPE '\\')) " +
            "ORDER BY n.updated_at DESC, n.id DESC LIMIT :limit OFFSET :offset")
    List<NoteRecord> search(@Bind("visibility") Visibility visibility,
                            @Bind("pattern") String pattern,
                            @Bind("limit") int limit,
                            @Bind("offset") int offset);
}
