package org.netpreserve.wikigraph.archive;

/**
 * The compressed span could not be read or decompressed.
 */
public class CorruptArchiveException extends ExtractionException {
    public CorruptArchiveException(IndexEntry entry, Throwable cause) {
        super(entry.title(), "Unable to decompress bytes " + entry.startOffset() + "-" +
                             (entry.readsToEnd() ? "EOF" : entry.endOffset()) + " for " + entry.title() +
                             ": " + cause.getMessage(), cause);
    }
}
