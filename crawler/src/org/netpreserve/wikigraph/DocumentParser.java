package org.netpreserve.wikigraph;

/**
 * Turns the reconstructed XML of a page into an {@link Article}.
 */
public interface DocumentParser {
    Article parse(String rawText) throws DocumentParseException;
}
