package org.netpreserve.wikigraph;

public class DocumentParseException extends Exception {
    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
