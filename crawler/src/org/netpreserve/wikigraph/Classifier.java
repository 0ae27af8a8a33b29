package org.netpreserve.wikigraph;

/**
 * Decides whether an article belongs in the graph.
 */
@FunctionalInterface
public interface Classifier {
    boolean classify(Article article);
}
