package org.netpreserve.wikigraph;

/**
 * Summary of a finished crawl.
 *
 * @param accepted  links newly classified as accepted
 * @param expanded  nodes whose links were followed
 * @param extracted pages read from the archive, seeds included
 * @param cacheHits links answered from the classification cache
 * @param failures  seeds and links that could not be read, parsed or classified
 * @param edges     edges registered
 */
public record CrawlStats(long accepted, long expanded, long extracted, long cacheHits, long failures, long edges,
                         StopReason stopReason) {
    public enum StopReason {
        BOUND_REACHED, QUEUE_EXHAUSTED
    }
}
