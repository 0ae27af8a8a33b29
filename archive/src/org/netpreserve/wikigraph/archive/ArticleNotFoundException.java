package org.netpreserve.wikigraph.archive;

public class ArticleNotFoundException extends ExtractionException {
    public ArticleNotFoundException(String title) {
        super(title, "No index entry for title: " + title);
    }
}
