package org.netpreserve.wikigraph.archive;

import java.util.List;

/**
 * Read access to the title and page id lookup tables built from the dump's index listing.
 * Results are always in listing order so that duplicate titles resolve the same way every run.
 */
public interface OffsetIndex extends AutoCloseable {
    List<IndexEntry> lookup(String title);

    List<IndexEntry> lookupById(String documentId);

    @Override
    void close();
}
