package org.netpreserve.wikigraph.db;

import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.Optional;

public interface ClassificationDAO {
    @SqlQuery("SELECT accepted FROM classifications WHERE title = ?")
    Optional<Boolean> find(String title);

    @SqlUpdate("INSERT INTO classifications (title, accepted, date) VALUES (:title, :accepted, :date) " +
               "ON CONFLICT (title) DO UPDATE SET accepted = excluded.accepted, date = excluded.date")
    void save(String title, boolean accepted, Instant date);

    @SqlQuery("SELECT COUNT(*) FROM classifications WHERE accepted")
    long countAccepted();

    @SqlQuery("SELECT COUNT(*) FROM classifications")
    long count();

    @SqlUpdate("DELETE FROM classifications")
    void deleteAll();
}
