package org.netpreserve.wikigraph;

import java.util.List;
import java.util.Map;

/**
 * Where accepted articles and the links between them end up.
 */
public interface GraphStore {
    /**
     * Adds a node unless one with identical properties already exists.
     *
     * @return the handle of the new or existing node
     */
    long addNode(Map<String, Object> properties);

    /**
     * Adds a directed edge. Adding the same edge again has no effect.
     */
    void addEdge(long from, long to);

    /**
     * Removes all nodes and edges.
     */
    void clear();

    Map<String, Object> node(long handle);

    List<Long> outgoing(long handle);

    long nodeCount();

    long edgeCount();
}
