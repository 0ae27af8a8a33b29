package org.netpreserve.wikigraph;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.wikigraph.archive.ArticleNotFoundException;
import org.netpreserve.wikigraph.archive.DocumentSource;
import org.netpreserve.wikigraph.archive.ExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Breadth-first crawl over the links between articles.
 * <p>
 * Starting from trusted seed articles, each link of each queued article is classified unless the
 * {@link ClassificationCache} already has a verdict for it. Accepted links are added to the {@link GraphStore} and
 * queued in turn; pages accepted by an earlier run are still read for their links but don't count as newly
 * accepted. The crawl ends once {@code bound} links have been newly accepted (checked between articles) or when the
 * queue runs dry. A link to a redirect page stands for the redirect's target.
 * <p>
 * A link that cannot be read, parsed or classified counts as rejected. Such failures are logged and never abort the
 * crawl, and the page is not retried during the same run.
 */
public class CrawlEngine {
    private static final Logger log = LoggerFactory.getLogger(CrawlEngine.class);
    private final DocumentSource documents;
    private final DocumentParser parser;
    private final Classifier classifier;
    private final ClassificationCache cache;
    private final GraphStore graph;
    private final int bound;

    public CrawlEngine(DocumentSource documents, DocumentParser parser, Classifier classifier,
                       ClassificationCache cache, GraphStore graph, int bound) {
        if (bound < 0) throw new IllegalArgumentException("negative bound: " + bound);
        this.documents = documents;
        this.parser = parser;
        this.classifier = classifier;
        this.cache = cache;
        this.graph = graph;
        this.bound = bound;
    }

    /**
     * State of a single {@link #run}.
     */
    private static class Crawl {
        final Queue<CrawlNode> queue = new ArrayDeque<>();
        final Map<String, CrawlNode> nodesById = new HashMap<>();
        final Map<String, CrawlNode> nodesByTitle = new HashMap<>();
        final Set<String> failedTitles = new HashSet<>();
        long accepted;
        long expanded;
        long extracted;
        long cacheHits;
        long failures;
        long edges;
    }

    public CrawlStats run(List<String> seeds) {
        var crawl = new Crawl();
        for (String title : seeds) {
            Article article = read(crawl, title, null);
            if (article == null) continue;
            cache.set(title, true);
            register(crawl, title, article);
        }
        log.info("Crawling from {} seeds until {} articles are accepted", crawl.queue.size(), bound);

        while (!crawl.queue.isEmpty() && crawl.accepted < bound) {
            CrawlNode node = crawl.queue.remove();
            if (!node.expandable()) {
                log.debug("Not expanding {} as its page was never read", node.title());
                continue;
            }
            List<String> links = node.article().links();
            log.atInfo()
                    .addKeyValue("title", node.title())
                    .addKeyValue("links", links.size())
                    .addKeyValue("accepted", crawl.accepted)
                    .addKeyValue("queued", crawl.queue.size())
                    .log("Expanding article");
            crawl.expanded++;
            for (String link : links) {
                visitLink(crawl, node, link);
            }
        }

        var stopReason = crawl.accepted >= bound ? CrawlStats.StopReason.BOUND_REACHED
                : CrawlStats.StopReason.QUEUE_EXHAUSTED;
        var stats = new CrawlStats(crawl.accepted, crawl.expanded, crawl.extracted, crawl.cacheHits, crawl.failures,
                crawl.edges, stopReason);
        log.info("Crawl finished: {}", stats);
        return stats;
    }

    private void visitLink(Crawl crawl, CrawlNode from, String link) {
        CrawlNode target = acceptedNode(crawl, from, link, true);
        if (target == null) return;
        graph.addEdge(from.handle(), target.handle());
        crawl.edges++;
    }

    /**
     * Returns the node for a link if the linked article is accepted, classifying it first unless the cache already
     * knows. A link to a redirect stands for the redirect's target, which is followed one hop.
     */
    private @Nullable CrawlNode acceptedNode(Crawl crawl, CrawlNode from, String link, boolean followRedirect) {
        Optional<Boolean> cached = cache.get(link);
        if (cached.isPresent()) {
            crawl.cacheHits++;
            return cached.get() ? nodeForCachedLink(crawl, from, link, followRedirect) : null;
        }
        if (crawl.failedTitles.contains(link)) return null;
        Article article = read(crawl, link, from);
        if (article == null) return null;
        if (followRedirect && isRedirectAway(article, link)) {
            return resolveRedirect(crawl, from, link, article.redirect());
        }

        boolean accepted;
        try {
            accepted = classifier.classify(article);
        } catch (RuntimeException e) {
            fail(crawl, link, from, e);
            return null;
        }
        cache.set(link, accepted);
        if (!accepted) return null;
        crawl.accepted++;
        log.atInfo().addKeyValue("title", link).addKeyValue("from", from.title())
                .addKeyValue("accepted", crawl.accepted).log("Accepted article");
        return register(crawl, link, article);
    }

    /**
     * Resolves a redirect to the target's node and gives the redirect title the same verdict as its target.
     */
    private @Nullable CrawlNode resolveRedirect(Crawl crawl, CrawlNode from, String link, String target) {
        log.debug("Following redirect from {} to {}", link, target);
        CrawlNode node = acceptedNode(crawl, from, target, false);
        if (node != null) {
            crawl.nodesByTitle.put(link, node);
            cache.set(link, true);
        } else if (!crawl.failedTitles.contains(target)) {
            cache.set(link, false);
        }
        return node;
    }

    private static boolean isRedirectAway(Article article, String title) {
        return article.redirect() != null && !article.redirect().equals(title);
    }

    /**
     * Finds the node for a link the cache already accepted. A page not seen yet in this run is read for its links,
     * without counting it as newly accepted. If it can't be read it's registered from its index entry as a
     * placeholder that won't be expanded.
     */
    private @Nullable CrawlNode nodeForCachedLink(Crawl crawl, CrawlNode from, String link, boolean followRedirect) {
        CrawlNode node = crawl.nodesByTitle.get(link);
        if (node != null) return node;
        if (crawl.failedTitles.contains(link)) return placeholder(crawl, link);
        Article article = read(crawl, link, from);
        if (article == null) return placeholder(crawl, link);
        if (followRedirect && isRedirectAway(article, link)) {
            log.debug("Following cached redirect from {} to {}", link, article.redirect());
            node = acceptedNode(crawl, from, article.redirect(), false);
            if (node != null) crawl.nodesByTitle.put(link, node);
            return node;
        }
        return register(crawl, link, article);
    }

    private @Nullable CrawlNode placeholder(Crawl crawl, String link) {
        try {
            var entry = documents.resolve(link);
            return register(crawl, link, Article.unparsed(entry.documentId(), entry.title()));
        } catch (ArticleNotFoundException e) {
            log.debug("No index entry for {}", link);
            return null;
        }
    }

    /**
     * Returns the node for an accepted article, adding it to the graph and the queue unless an article with the
     * same id was already registered during this run.
     */
    private CrawlNode register(Crawl crawl, String title, Article article) {
        CrawlNode node = crawl.nodesById.get(article.id());
        if (node == null) {
            long handle = graph.addNode(article.nodeProperties());
            node = new CrawlNode(article, handle);
            crawl.nodesById.put(article.id(), node);
            crawl.queue.add(node);
        } else if (!node.title().equals(title)) {
            log.debug("{} resolves to already registered article {} ({})", title, node.title(), article.id());
        }
        crawl.nodesByTitle.put(title, node);
        return node;
    }

    private @Nullable Article read(Crawl crawl, String title, @Nullable CrawlNode from) {
        try {
            var document = documents.retrieve(title);
            crawl.extracted++;
            return parser.parse(document.rawText());
        } catch (ExtractionException | DocumentParseException | RuntimeException e) {
            fail(crawl, title, from, e);
            return null;
        }
    }

    private void fail(Crawl crawl, String title, @Nullable CrawlNode from, Exception e) {
        crawl.failures++;
        crawl.failedTitles.add(title);
        if (from == null) {
            log.error("Unable to read seed {}: {}", title, e.toString());
        } else {
            log.atWarn()
                    .addKeyValue("title", title)
                    .addKeyValue("from", from.title())
                    .addKeyValue("error", e.getClass().getSimpleName())
                    .log("Unable to process link: {}", e.getMessage());
        }
    }
}
