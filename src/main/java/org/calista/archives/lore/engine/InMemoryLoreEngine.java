package org.calista.archives.lore.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.entry.RelationshipType;
import org.calista.archives.lore.graph.RelatedEntry;
import org.calista.archives.lore.graph.RelationshipGraph;
import org.calista.archives.lore.graph.RelationshipNavigator;
import org.calista.archives.lore.index.BuildReport;
import org.calista.archives.lore.index.IndexBuilder;
import org.calista.archives.lore.index.IndexSnapshot;
import org.calista.archives.lore.index.IndexedEntry;
import org.calista.archives.lore.search.FuzzySearchEngine;
import org.calista.archives.lore.search.Scored;
import org.calista.archives.lore.search.SearchHit;
import org.calista.archives.lore.search.scorer.RelevanceScorer;
import org.calista.archives.lore.search.scorer.impl.WeightedFuzzyScorer;
import org.calista.archives.lore.stats.LoreStatistics;
import org.calista.archives.lore.stats.StatisticsReporter;
import org.calista.archives.lore.store.LoreStore;
import org.calista.archives.lore.suggest.SimilarityRecommender;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * InMemoryLoreEngine: index + relationship graph held in memory, rebuilt in full on demand.
 *
 * <p>
 * Concurrency: a rebuild runs under one exclusive lock and publishes the new
 * {@link IndexSnapshot} through a volatile reference. Readers grab the reference once per
 * call, so they see either the old or the new structures, never a half-built mix.
 * </p>
 */
public final class InMemoryLoreEngine implements LoreEngine {
    private static final Logger log = LogManager.getLogger(InMemoryLoreEngine.class);

    // =========================
    // Config
    // =========================

    public static final class Config {
        public double fuzzyThreshold = 0.6;
        public int maxResults = 20;
        public boolean includeRelationships = true;

        public double minSimilarity = 0.3;

        public double defaultStrength = 5.0;
    }

    private final LoreStore store;
    private final IndexBuilder builder;
    private final FuzzySearchEngine searchEngine;
    private final RelationshipNavigator navigator = new RelationshipNavigator();
    private final SimilarityRecommender recommender;
    private final StatisticsReporter statistics = new StatisticsReporter();

    private final ReentrantLock rebuildLock = new ReentrantLock();
    private volatile IndexSnapshot snapshot = IndexSnapshot.empty();

    public InMemoryLoreEngine(LoreStore store, ObjectMapper mapper) {
        this(store, mapper, new Config());
    }

    public InMemoryLoreEngine(LoreStore store, ObjectMapper mapper, Config cfg) {
        this(store, mapper, cfg, new WeightedFuzzyScorer());
    }

    public InMemoryLoreEngine(LoreStore store, ObjectMapper mapper, Config cfg, RelevanceScorer scorer) {
        this.store = Objects.requireNonNull(store, "store");
        Config c = (cfg == null ? new Config() : cfg);
        this.builder = new IndexBuilder(Objects.requireNonNull(mapper, "mapper"), c.defaultStrength);
        this.searchEngine = new FuzzySearchEngine(scorer, c.fuzzyThreshold, c.maxResults, c.includeRelationships);
        this.recommender = new SimilarityRecommender(c.minSimilarity);

        refresh();
    }

    // =========================
    // Build
    // =========================

    @Override
    public BuildReport refresh() {
        rebuildLock.lock();
        try {
            IndexSnapshot next = builder.build(store);
            snapshot = next;
            if (!next.report.isClean()) {
                log.warn("Lore index rebuilt with {} issue(s); see build report", next.report.issues.size());
            }
            return next.report;
        } finally {
            rebuildLock.unlock();
        }
    }

    // =========================
    // Queries
    // =========================

    @Override
    public List<SearchHit> search(String query, Category category, Collection<String> tags, Integer limit) {
        return searchEngine.search(snapshot, query, category, tags, limit);
    }

    @Override
    public List<RelatedEntry> related(String entryId, RelationshipType type, int maxDepth) {
        return navigator.related(snapshot, entryId, type, maxDepth);
    }

    @Override
    public List<Scored<IndexedEntry>> suggest(String entryId, int limit) {
        return recommender.suggest(snapshot, entryId, limit);
    }

    @Override
    public LoreStatistics statistics() {
        return statistics.report(snapshot);
    }

    @Override
    public RelationshipGraph graphView(Collection<String> entryIds) {
        IndexSnapshot s = snapshot;
        if (entryIds == null || entryIds.isEmpty()) return s.graph;
        return s.graph.subgraph(entryIds);
    }

    @Override
    public IndexSnapshot snapshot() {
        return snapshot;
    }
}
