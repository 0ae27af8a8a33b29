package org.netpreserve.wikigraph;

import java.util.Optional;

/**
 * Remembers classification verdicts by article title so that pages are only read and classified once.
 * Implementations need not be thread-safe.
 */
public interface ClassificationCache {
    Optional<Boolean> get(String title);

    void set(String title, boolean accepted);
}
