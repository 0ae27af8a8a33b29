package org.netpreserve.wikigraph;

import org.netpreserve.wikigraph.archive.ArchiveExtractor;
import org.netpreserve.wikigraph.archive.ExtractedDocument;
import org.netpreserve.wikigraph.archive.ExtractionException;
import org.netpreserve.wikigraph.archive.IndexDatabase;
import org.netpreserve.wikigraph.config.JobConfig;
import org.netpreserve.wikigraph.db.SqliteClassificationCache;
import org.netpreserve.wikigraph.db.SqliteGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Wires the archive, the crawler database and the crawl engine together for one job directory.
 */
public class Job implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Job.class);
    private final JobConfig config;
    private final ArchiveExtractor extractor;
    private final Database db;
    private final GraphStore graph;
    private final CrawlEngine engine;

    public Job(Path jobDir, JobConfig config) throws IOException {
        this.config = config;
        var index = IndexDatabase.openExisting(jobDir.resolve(config.archive().index()));
        try {
            long cacheSize = config.archive().cacheSize() == null ? 0 : config.archive().cacheSize();
            this.extractor = new ArchiveExtractor(jobDir.resolve(config.archive().file()), index, cacheSize);
        } catch (IOException | RuntimeException e) {
            index.close();
            throw e;
        }
        Database db = null;
        try {
            db = Database.open(jobDir.resolve(config.storage().database()));
            this.graph = new SqliteGraphStore(db.graph());
            this.engine = new CrawlEngine(extractor, new WikitextParser(),
                    new InfoboxClassifier(config.classifier().infoboxTypes()),
                    new SqliteClassificationCache(db.classifications()), graph, config.crawl().bound());
        } catch (RuntimeException e) {
            if (db != null) db.close();
            extractor.close();
            throw e;
        }
        this.db = db;
    }

    public CrawlStats crawl(List<String> seeds) {
        if (config.crawl().clearGraph()) {
            log.info("Clearing {} nodes from the graph", graph.nodeCount());
            graph.clear();
        }
        return engine.run(seeds);
    }

    public ExtractedDocument extract(String title) throws ExtractionException {
        return extractor.retrieve(title);
    }

    public GraphStore graph() {
        return graph;
    }

    public JobConfig config() {
        return config;
    }

    @Override
    public void close() {
        try {
            db.close();
        } catch (Exception e) {
            log.error("Failed to close database", e);
        }
        try {
            extractor.close();
        } catch (Exception e) {
            log.error("Failed to close archive index", e);
        }
    }
}
