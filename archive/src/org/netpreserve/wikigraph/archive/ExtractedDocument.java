package org.netpreserve.wikigraph.archive;

/**
 * A single page reconstructed from a decompressed block.
 */
public record ExtractedDocument(String documentId, String title, String rawText) {
}
