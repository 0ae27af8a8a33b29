package org.netpreserve.wikigraph.config;

/**
 * Root configuration for a crawl job. Relative paths are resolved against the job directory.
 *
 * @param archive    where the dump and its index are
 * @param crawl      seeds and limits
 * @param classifier which articles to accept
 * @param storage    where the classification cache and graph are kept
 */
public record JobConfig(
        ArchiveConfig archive,
        CrawlConfig crawl,
        ClassifierConfig classifier,
        StorageConfig storage
) {
    public JobConfig withCrawl(CrawlConfig crawl) {
        return new JobConfig(archive, crawl, classifier, storage);
    }
}
