package org.netpreserve.wikigraph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.wikigraph.db.SqliteClassificationCache;
import org.netpreserve.wikigraph.db.SqliteGraphStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.wikigraph.FakeWiki.MUSICIAN;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class CrawlEngineTest {
    private final Database database;
    private ClassificationCache cache;
    private GraphStore graph;
    private FakeWiki wiki;

    CrawlEngineTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() {
        database.useHandle(handle -> {
            handle.execute("DELETE FROM edges");
            handle.execute("DELETE FROM nodes");
            handle.execute("DELETE FROM classifications");
        });
        cache = new SqliteClassificationCache(database.classifications());
        graph = new SqliteGraphStore(database.graph());
        wiki = new FakeWiki();
    }

    private CrawlEngine engine(int bound) {
        return new CrawlEngine(wiki, new WikitextParser(), new InfoboxClassifier(List.of("musical artist")), cache,
                graph, bound);
    }

    private long handle(String title) {
        return graph.addNode(Map.of("id", wiki.id(title), "title", title));
    }

    @Test
    void stopsOnceBoundIsReached() {
        wiki.page("A", "Links to [[B]].")
                .page("B", MUSICIAN + "Played with [[C]].")
                .page("C", "See [[D]].");

        var stats = engine(1).run(List.of("A"));

        assertEquals(1, stats.accepted());
        assertEquals(CrawlStats.StopReason.BOUND_REACHED, stats.stopReason());
        assertEquals(List.of("A", "B"), wiki.retrieved, "C must never be read");
        assertEquals(2, graph.nodeCount());
        assertEquals(List.of(handle("B")), graph.outgoing(handle("A")));
        assertEquals(List.of(), graph.outgoing(handle("B")));
        assertEquals(Optional.of(true), cache.get("A"));
        assertEquals(Optional.of(true), cache.get("B"));
        assertEquals(Optional.empty(), cache.get("C"));
    }

    @Test
    void rejectedLinksAreCachedButNotAdded() {
        wiki.page("A", "Links to [[B]].")
                .page("B", MUSICIAN + "Played with [[C]].")
                .page("C", "See [[D]].");

        var stats = engine(10).run(List.of("A"));

        assertEquals(CrawlStats.StopReason.QUEUE_EXHAUSTED, stats.stopReason());
        assertEquals(1, stats.accepted());
        assertEquals(2, stats.expanded());
        assertEquals(3, stats.extracted());
        assertEquals(Optional.of(false), cache.get("C"));
        assertEquals(2, graph.nodeCount());
        assertEquals(1, graph.edgeCount());
        assertEquals(Optional.empty(), cache.get("D"), "links of rejected articles are not followed");
    }

    @Test
    void cacheHitsAddEdgesWithoutCountingTowardsBound() {
        wiki.page("A", "[[B]] and [[C]]")
                .page("B", MUSICIAN)
                .page("C", MUSICIAN + "Member of [[B]].");

        var stats = engine(10).run(List.of("A"));

        assertEquals(2, stats.accepted());
        assertEquals(1, stats.cacheHits());
        assertEquals(3, stats.extracted());
        assertEquals(1, wiki.retrievals("B"));
        assertEquals(3, stats.edges());
        assertEquals(List.of(handle("B")), graph.outgoing(handle("C")));
    }

    @Test
    void acceptedFromEarlierRunIsReadWithoutCounting() {
        wiki.page("A", "[[B]] and [[X]]")
                .page("B", MUSICIAN + "[[C]]")
                .page("C", MUSICIAN)
                .page("X", "not a musician");
        cache.set("B", true);
        cache.set("X", false);

        var stats = engine(10).run(List.of("A"));

        assertEquals(List.of("A", "B", "C"), wiki.retrieved);
        assertEquals(1, stats.accepted(), "only C is newly accepted");
        assertEquals(2, stats.cacheHits());
        assertEquals(3, stats.expanded());
        assertEquals(List.of(handle("B")), graph.outgoing(handle("A")));
        assertEquals(List.of(handle("C")), graph.outgoing(handle("B")));
    }

    @Test
    void unreadableCachedPageBecomesPlaceholder() {
        wiki.page("A", "[[B]]").corruptPage("B");
        cache.set("B", true);

        var stats = engine(10).run(List.of("A"));

        assertEquals(0, stats.accepted());
        assertEquals(1, stats.failures());
        assertEquals(1, stats.expanded(), "B has no known links to expand");
        assertEquals(List.of(handle("B")), graph.outgoing(handle("A")));
        assertEquals(Map.of("id", wiki.id("B"), "title", "B"), graph.node(handle("B")));
        assertEquals(Optional.of(true), cache.get("B"));
    }

    @Test
    void recrawlWithWarmCacheRebuildsTheSameGraph() {
        wiki.page("A", "[[B]]")
                .page("B", MUSICIAN + "[[C]]")
                .page("C", MUSICIAN + "[[D]]")
                .page("D", MUSICIAN);

        var first = engine(10).run(List.of("A"));
        assertEquals(3, first.accepted());
        assertEquals(4, graph.nodeCount());
        assertEquals(3, graph.edgeCount());

        graph.clear();
        wiki.retrieved.clear();
        var second = engine(10).run(List.of("A"));

        assertEquals(0, second.accepted());
        assertEquals(3, second.cacheHits());
        assertEquals(4, second.expanded());
        assertEquals(CrawlStats.StopReason.QUEUE_EXHAUSTED, second.stopReason());
        assertEquals(List.of("A", "B", "C", "D"), wiki.retrieved);
        assertEquals(4, graph.nodeCount());
        assertEquals(3, graph.edgeCount());
        assertEquals(List.of(handle("D")), graph.outgoing(handle("C")));
    }

    @Test
    void redirectedLinkReachesItsTarget() {
        wiki.page("A", "[[Coltrane]] and [[John Coltrane]]")
                .redirect("Coltrane", "John Coltrane")
                .page("John Coltrane", MUSICIAN);

        var stats = engine(10).run(List.of("A"));

        assertEquals(1, stats.accepted());
        assertEquals(List.of("A", "Coltrane", "John Coltrane"), wiki.retrieved);
        assertEquals(Optional.of(true), cache.get("Coltrane"));
        assertEquals(Optional.of(true), cache.get("John Coltrane"));
        assertEquals(2, graph.nodeCount());
        assertEquals(1, graph.edgeCount());
        assertEquals(List.of(handle("John Coltrane")), graph.outgoing(handle("A")));

        graph.clear();
        var again = engine(10).run(List.of("A"));
        assertEquals(0, again.accepted());
        assertEquals(2, graph.nodeCount());
        assertEquals(List.of(handle("John Coltrane")), graph.outgoing(handle("A")));
    }

    @Test
    void redirectTakesItsTargetsVerdict() {
        wiki.page("A", "[[Trumpeter]] [[Gone]]")
                .redirect("Trumpeter", "Trumpet")
                .page("Trumpet", "A brass instrument.")
                .redirect("Gone", "Nowhere");

        var stats = engine(10).run(List.of("A"));

        assertEquals(0, stats.accepted());
        assertEquals(1, stats.failures());
        assertEquals(Optional.of(false), cache.get("Trumpeter"));
        assertEquals(Optional.of(false), cache.get("Trumpet"));
        assertEquals(Optional.empty(), cache.get("Gone"), "a redirect to a missing page is a failure, not a verdict");
        assertEquals(1, graph.nodeCount());
    }

    @Test
    void failuresCountAsRejectedAndAreNotRetried() {
        wiki.page("A", "[[Missing]] [[Broken]] [[Garbled]] [[B]]")
                .corruptPage("Broken")
                .rawPage("Garbled", "<page><title>Garbled</title><id>")
                .page("B", MUSICIAN + "[[Broken]] [[Missing]]");

        var stats = engine(10).run(List.of("A"));

        assertEquals(1, stats.accepted());
        assertEquals(3, stats.failures());
        assertEquals(1, stats.edges());
        assertEquals(1, wiki.retrievals("Broken"));
        assertEquals(1, wiki.retrievals("Missing"));
        assertEquals(Optional.empty(), cache.get("Broken"));
        assertEquals(Optional.empty(), cache.get("Garbled"));
        assertEquals(CrawlStats.StopReason.QUEUE_EXHAUSTED, stats.stopReason());
    }

    @Test
    void classifierErrorsCountAsRejected() {
        wiki.page("A", "[[B]] [[C]]")
                .page("B", "boom")
                .page("C", MUSICIAN);
        Classifier classifier = article -> {
            if (article.title().equals("B")) throw new IllegalStateException("boom");
            return article.text().contains("Infobox");
        };

        var stats = new CrawlEngine(wiki, new WikitextParser(), classifier, cache, graph, 10).run(List.of("A"));

        assertEquals(1, stats.accepted());
        assertEquals(1, stats.failures());
        assertEquals(Optional.empty(), cache.get("B"));
        assertEquals(Optional.of(true), cache.get("C"));
    }

    @Test
    void cyclesAreExpandedOnce() {
        wiki.page("A", "[[B]]")
                .page("B", MUSICIAN + "[[A]] [[B]]");

        var stats = engine(10).run(List.of("A"));

        assertEquals(2, stats.expanded());
        assertEquals(1, stats.accepted());
        assertEquals(List.of("A", "B"), wiki.retrieved);
        assertEquals(2, graph.nodeCount());
        assertEquals(List.of(handle("A"), handle("B")), graph.outgoing(handle("B")).stream().sorted().toList());
    }

    @Test
    void expandsBreadthFirst() {
        wiki.page("A", "[[B]] [[C]]")
                .page("B", MUSICIAN + "[[D]]")
                .page("C", MUSICIAN + "[[E]]")
                .page("D", MUSICIAN)
                .page("E", MUSICIAN);

        var stats = engine(100).run(List.of("A"));

        assertEquals(List.of("A", "B", "C", "D", "E"), wiki.retrieved);
        assertEquals(4, stats.accepted());
        assertEquals(5, stats.expanded());
    }

    @Test
    void boundIsCheckedBetweenArticles() {
        wiki.page("A", "[[B]] [[C]] [[D]]")
                .page("B", MUSICIAN)
                .page("C", MUSICIAN)
                .page("D", MUSICIAN);

        var stats = engine(1).run(List.of("A"));

        assertEquals(3, stats.accepted(), "all links of an expanded article are visited");
        assertEquals(CrawlStats.StopReason.BOUND_REACHED, stats.stopReason());
        assertEquals(1, stats.expanded());
    }

    @Test
    void badSeedsAreSkipped() {
        wiki.page("A", "[[B]]").page("B", MUSICIAN);

        var stats = engine(5).run(List.of("Nope", "A", "A"));

        assertEquals(1, stats.failures());
        assertEquals(1, stats.accepted());
        assertEquals(2, stats.expanded());
        assertEquals(2, graph.nodeCount());
    }

    @Test
    void zeroBoundOnlyRegistersSeeds() {
        wiki.page("A", "[[B]]").page("B", MUSICIAN);

        var stats = engine(0).run(List.of("A"));

        assertEquals(CrawlStats.StopReason.BOUND_REACHED, stats.stopReason());
        assertEquals(0, stats.expanded());
        assertEquals(1, graph.nodeCount());
    }

    @Test
    void noSeeds() {
        var stats = engine(5).run(List.of());
        assertEquals(new CrawlStats(0, 0, 0, 0, 0, 0, CrawlStats.StopReason.QUEUE_EXHAUSTED), stats);
    }

    @Test
    void rejectsNegativeBound() {
        assertThrows(IllegalArgumentException.class, () -> engine(-1));
    }
}
