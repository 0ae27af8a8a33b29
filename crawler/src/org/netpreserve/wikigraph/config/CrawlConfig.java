package org.netpreserve.wikigraph.config;

import java.util.List;

/**
 * Configuration for how the crawl should behave.
 *
 * @param seeds      titles of the articles to start from, used when none are given on the command line
 * @param bound      number of newly accepted articles after which the crawl stops
 * @param clearGraph whether to empty the graph store before crawling
 */
public record CrawlConfig(
        List<String> seeds,
        int bound,
        boolean clearGraph
) {
    public CrawlConfig withBound(int bound) {
        return new CrawlConfig(seeds, bound, clearGraph);
    }
}
