package org.netpreserve.wikigraph.archive;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

@RegisterConstructorMapper(IndexEntry.class)
public interface IndexEntryDAO {
    String SELECT_ENTRY = """
            SELECT title, page_id AS document_id, first_byte AS start_offset, last_byte AS end_offset
            FROM pages
            """;

    @SqlQuery(SELECT_ENTRY + "WHERE title = ? ORDER BY row_id")
    List<IndexEntry> findByTitle(String title);

    @SqlQuery(SELECT_ENTRY + "WHERE page_id = ? ORDER BY row_id")
    List<IndexEntry> findById(String documentId);

    @SqlBatch("INSERT INTO pages (first_byte, page_id, title, last_byte) " +
              "VALUES (:startOffset, :documentId, :title, :endOffset)")
    void insertAll(@BindMethods List<IndexEntry> entries);

    @SqlUpdate("DELETE FROM pages")
    void deleteAll();

    @SqlQuery("SELECT COUNT(*) FROM pages")
    long count();

    @SqlQuery("SELECT COUNT(DISTINCT first_byte) FROM pages")
    long countStreams();
}
