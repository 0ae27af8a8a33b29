package org.netpreserve.wikigraph.archive;

import org.jetbrains.annotations.Nullable;

/**
 * The indexed block decompressed fine but no page with the expected id could be found in it. The cause, if any, is
 * the XML error that made the rest of the block unreadable.
 */
public class ScanNotFoundException extends ExtractionException {
    public ScanNotFoundException(IndexEntry entry) {
        this(entry, null);
    }

    public ScanNotFoundException(IndexEntry entry, @Nullable Throwable cause) {
        super(entry.title(), "Page id " + entry.documentId() + " not found in block at offset " +
                             entry.startOffset() + " for " + entry.title() +
                             (cause == null ? "" : " (block unreadable: " + cause.getMessage() + ")"), cause);
    }
}
