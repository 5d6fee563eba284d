package org.calista.archives.lore.engine;

import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.entry.RelationshipType;
import org.calista.archives.lore.graph.RelatedEntry;
import org.calista.archives.lore.graph.RelationshipGraph;
import org.calista.archives.lore.index.BuildReport;
import org.calista.archives.lore.index.IndexSnapshot;
import org.calista.archives.lore.index.IndexedEntry;
import org.calista.archives.lore.search.Scored;
import org.calista.archives.lore.search.SearchHit;
import org.calista.archives.lore.stats.LoreStatistics;

import java.util.Collection;
import java.util.List;

/**
 * LoreEngine: query surface over the lore corpus.
 *
 * <p>
 * Reads are served from the last built snapshot. Store changes become visible only after
 * {@link #refresh()}. Query operations never throw for unknown ids or blank queries; they
 * return empty lists.
 * </p>
 */
public interface LoreEngine {

    int DEFAULT_SUGGESTION_LIMIT = 5;

    /** Rebuilds index and graph from the store and swaps them in as one snapshot. */
    BuildReport refresh();

    default List<SearchHit> search(String query) {
        return search(query, null, null, null);
    }

    /**
     * Ranked fuzzy search.
     *
     * @param category optional category filter
     * @param tags     optional any-of tag filter
     * @param limit    optional cap; null means the configured max results
     */
    List<SearchHit> search(String query, Category category, Collection<String> tags, Integer limit);

    default List<RelatedEntry> related(String entryId) {
        return related(entryId, null, 1);
    }

    List<RelatedEntry> related(String entryId, RelationshipType type, int maxDepth);

    default List<Scored<IndexedEntry>> suggest(String entryId) {
        return suggest(entryId, DEFAULT_SUGGESTION_LIMIT);
    }

    List<Scored<IndexedEntry>> suggest(String entryId, int limit);

    LoreStatistics statistics();

    /**
     * Read-only view of the relationship graph; the induced subgraph when ids are given.
     */
    RelationshipGraph graphView(Collection<String> entryIds);

    /** Current snapshot (index + graph + build report). */
    IndexSnapshot snapshot();
}
