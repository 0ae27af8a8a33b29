package org.netpreserve.wikigraph;

/**
 * An accepted article together with the handle of its node in the graph store.
 */
public record CrawlNode(Article article, long handle) {
    public String documentId() {
        return article.id();
    }

    public String title() {
        return article.title();
    }

    /**
     * Whether the article's links are known. Placeholders for accepted pages that could not be read are not
     * expanded.
     */
    public boolean expandable() {
        return article.links() != null;
    }
}
