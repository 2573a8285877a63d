package com.libragraph.stash.core.dao;

import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

public interface NoteTagDao {

    @SqlBatch("INSERT INTO note_tag (note_id, tag) VALUES (:noteId, :tag)")
    void insertAll(@Bind("noteId") long noteId, @Bind("tag") List<String> tags);

    @SqlQuery("SELECT tag FROM note_tag WHERE note_id = :noteId ORDER BY id")
    List<String> findByNote(@Bind("noteId") long noteId);

    @SqlUpdate("DELETE FROM note_tag WHERE note_id = :noteId")
    int deleteByNote(@Bind("noteId") long noteId);
}
