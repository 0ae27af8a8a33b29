package org.netpreserve.wikigraph.config;

import java.nio.file.Path;

/**
 * Storage configuration.
 *
 * @param database SQLite file for the classification cache and the graph
 */
public record StorageConfig(
        Path database
) {
}
