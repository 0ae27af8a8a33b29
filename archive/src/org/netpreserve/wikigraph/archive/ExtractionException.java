package org.netpreserve.wikigraph.archive;

/**
 * Failure to extract a single document. Never fatal to anything beyond the one extraction.
 */
public abstract class ExtractionException extends Exception {
    private final String title;

    protected ExtractionException(String title, String message) {
        super(message);
        this.title = title;
    }

    protected ExtractionException(String title, String message, Throwable cause) {
        super(message, cause);
        this.title = title;
    }

    public String title() {
        return title;
    }
}
