package org.netpreserve.wikigraph.archive;

/**
 * Location of one page in the multistream archive.
 *
 * @param title       page title as listed in the dump index
 * @param documentId  value of the page's {@code <id>} element
 * @param startOffset offset of the compressed stream holding the page
 * @param endOffset   offset of the next stream, or {@link #END_OF_ARCHIVE} for the last stream
 */
public record IndexEntry(String title, String documentId, long startOffset, long endOffset) {
    public static final long END_OF_ARCHIVE = -1;

    public IndexEntry {
        if (startOffset < 0) throw new IllegalArgumentException("negative start offset: " + startOffset);
        if (endOffset != END_OF_ARCHIVE && endOffset <= startOffset) {
            throw new IllegalArgumentException("end offset " + endOffset + " not after start offset " + startOffset);
        }
    }

    public boolean readsToEnd() {
        return endOffset == END_OF_ARCHIVE;
    }
}
