package org.calista.archives.lore.search;

import org.calista.archives.lore.graph.RelationshipEdge;
import org.calista.archives.lore.index.IndexedEntry;

import java.util.List;
import java.util.Objects;

/**
 * One ranked search result. {@code relationships} holds the entry's outgoing edges when the
 * engine is configured to attach them, otherwise it is empty.
 */
public final class SearchHit {
    public final IndexedEntry entry;
    public final double score;
    public final List<RelationshipEdge> relationships;

    public SearchHit(IndexedEntry entry, double score, List<RelationshipEdge> relationships) {
        this.entry = Objects.requireNonNull(entry, "entry");
        this.score = score;
        this.relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    @Override
    public String toString() {
        return "SearchHit{" + entry.id() + ", score=" + String.format(java.util.Locale.ROOT, "%.2f", score) + '}';
    }
}
