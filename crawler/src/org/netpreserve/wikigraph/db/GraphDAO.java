package org.netpreserve.wikigraph.db;

import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transactional;

import java.util.List;

public interface GraphDAO extends Transactional<GraphDAO> {
    @SqlQuery("INSERT INTO nodes (properties) VALUES (:properties) " +
              "ON CONFLICT (properties) DO UPDATE SET properties = excluded.properties RETURNING id")
    long insertOrGetNodeId(String properties);

    @SqlQuery("SELECT properties FROM nodes WHERE id = ?")
    String findNodeProperties(long id);

    @SqlUpdate("INSERT INTO edges (source, target) VALUES (?, ?) ON CONFLICT DO NOTHING")
    void insertEdge(long source, long target);

    @SqlQuery("SELECT target FROM edges WHERE source = ? ORDER BY target")
    List<Long> findTargets(long source);

    @SqlQuery("SELECT COUNT(*) FROM nodes")
    long countNodes();

    @SqlQuery("SELECT COUNT(*) FROM edges")
    long countEdges();

    @SqlUpdate("DELETE FROM edges")
    void deleteAllEdges();

    @SqlUpdate("DELETE FROM nodes")
    void deleteAllNodes();
}
