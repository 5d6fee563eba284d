package org.calista.archives.lore.search.scorer;

import org.calista.archives.lore.index.IndexedEntry;

/**
 * Estimates relevance of an indexed entry to a free-text query, on a 0..100 scale.
 *
 * <p>Implementations must be deterministic. The query passed in is already lower-cased.</p>
 */
public interface RelevanceScorer {
    double score(String query, IndexedEntry entry);
}
