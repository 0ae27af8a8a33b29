package org.netpreserve.wikigraph.archive;

/**
 * Something pages can be pulled out of by title.
 */
public interface DocumentSource {
    /**
     * Finds where a page lives without reading it.
     */
    IndexEntry resolve(String title) throws ArticleNotFoundException;

    /**
     * Reads and reconstructs the page with the given title.
     */
    ExtractedDocument retrieve(String title) throws ExtractionException;
}
