package org.netpreserve.wikigraph.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.wikigraph.util.ByteSizeDeserializer;

import java.nio.file.Path;

/**
 * Archive configuration.
 *
 * @param file      the {@code pages-articles-multistream.xml.bz2} dump
 * @param index     the index database built by {@code build-index}
 * @param cacheSize how much recently extracted page text to keep in memory, e.g. {@code 16MB}
 */
public record ArchiveConfig(
        Path file,
        Path index,
        @JsonDeserialize(using = ByteSizeDeserializer.class)
        Long cacheSize
) {
}
