package org.netpreserve.wikigraph.config;

import java.util.List;

/**
 * @param infoboxTypes articles with an infobox of any of these types are accepted
 */
public record ClassifierConfig(
        List<String> infoboxTypes
) {
}
