package org.netpreserve.wikigraph.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.netpreserve.wikigraph.GraphStore;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Stores the graph in SQLite. Node properties are kept as key-sorted JSON under a unique constraint, which is what
 * makes {@link #addNode} idempotent.
 */
public class SqliteGraphStore implements GraphStore {
    private static final TypeReference<Map<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {
    };
    private final GraphDAO dao;
    private final ObjectMapper mapper;

    public SqliteGraphStore(GraphDAO dao) {
        this.dao = dao;
        this.mapper = new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    @Override
    public long addNode(Map<String, Object> properties) {
        return dao.insertOrGetNodeId(toJson(properties));
    }

    @Override
    public void addEdge(long from, long to) {
        dao.insertEdge(from, to);
    }

    @Override
    public void clear() {
        dao.useTransaction(tx -> {
            tx.deleteAllEdges();
            tx.deleteAllNodes();
        });
    }

    @Override
    public Map<String, Object> node(long handle) {
        String json = dao.findNodeProperties(handle);
        if (json == null) throw new NoSuchElementException("No node " + handle);
        try {
            return mapper.readValue(json, PROPERTIES_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt properties on node " + handle, e);
        }
    }

    @Override
    public List<Long> outgoing(long handle) {
        return dao.findTargets(handle);
    }

    @Override
    public long nodeCount() {
        return dao.countNodes();
    }

    @Override
    public long edgeCount() {
        return dao.countEdges();
    }

    private String toJson(Map<String, Object> properties) {
        try {
            return mapper.writeValueAsString(properties);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable node properties: " + properties, e);
        }
    }
}
