package org.calista.archives.lore.search;

import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.index.IndexSnapshot;
import org.calista.archives.lore.index.IndexedEntry;
import org.calista.archives.lore.search.scorer.RelevanceScorer;

import java.util.*;

/**
 * Free-text search over one index snapshot.
 *
 * <p>
 * Pipeline: category filter -> tag filter (any-of) -> score -> threshold -> stable sort by
 * score desc -> limit. Blank queries return nothing; there is no "list everything" fallback.
 * </p>
 */
public final class FuzzySearchEngine {

    private final RelevanceScorer scorer;
    private final double fuzzyThreshold;
    private final int maxResults;
    private final boolean includeRelationships;

    /**
     * @param fuzzyThreshold       minimum normalized score in [0, 1]
     * @param maxResults           cap used when a call gives no limit
     * @param includeRelationships attach outgoing edges to each hit
     */
    public FuzzySearchEngine(RelevanceScorer scorer, double fuzzyThreshold, int maxResults, boolean includeRelationships) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        if (!Double.isFinite(fuzzyThreshold) || fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0) {
            throw new IllegalArgumentException("fuzzyThreshold must be within [0, 1]: " + fuzzyThreshold);
        }
        if (maxResults < 1) throw new IllegalArgumentException("maxResults must be >= 1: " + maxResults);
        this.fuzzyThreshold = fuzzyThreshold;
        this.maxResults = maxResults;
        this.includeRelationships = includeRelationships;
    }

    /**
     * @param category optional category filter (null = any)
     * @param tags     optional tag filter, any-of, case-insensitive (null/empty = any)
     * @param limit    optional result cap (null or &lt; 1 = configured max results)
     */
    public List<SearchHit> search(IndexSnapshot snapshot, String query, Category category,
                                  Collection<String> tags, Integer limit) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (query == null || query.isBlank()) return List.of();

        String q = query.toLowerCase(Locale.ROOT);
        Set<String> wantedTags = normalizeTags(tags);
        double minScore = fuzzyThreshold * 100.0;

        ArrayList<Scored<IndexedEntry>> scored = new ArrayList<>();
        for (IndexedEntry e : snapshot.index.entries()) {
            if (category != null && e.category() != category) continue;
            if (!wantedTags.isEmpty() && !hasAnyTag(e, wantedTags)) continue;

            double s = scorer.score(q, e);
            if (s >= minScore) scored.add(Scored.of(e, s));
        }

        scored.sort(Scored.byScoreDescending());

        int cap = (limit == null || limit < 1) ? maxResults : limit;
        int n = Math.min(cap, scored.size());

        ArrayList<SearchHit> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Scored<IndexedEntry> s = scored.get(i);
            out.add(new SearchHit(s.item, s.score,
                    includeRelationships ? snapshot.graph.outgoing(s.item.id()) : List.of()));
        }
        return Collections.unmodifiableList(out);
    }

    public int maxResults() {
        return maxResults;
    }

    public double fuzzyThreshold() {
        return fuzzyThreshold;
    }

    private static Set<String> normalizeTags(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) return Set.of();
        HashSet<String> out = new HashSet<>();
        for (String t : tags) {
            if (t == null) continue;
            String x = t.trim().toLowerCase(Locale.ROOT);
            if (!x.isEmpty()) out.add(x);
        }
        return out;
    }

    private static boolean hasAnyTag(IndexedEntry e, Set<String> wanted) {
        for (String t : e.tagsLower()) {
            if (wanted.contains(t)) return true;
        }
        return false;
    }
}
