package org.calista.archives.lore.graph;

import org.calista.archives.lore.entry.RelationshipType;
import org.calista.archives.lore.index.IndexedEntry;

import java.util.Objects;

/**
 * Entry reached by a relationship traversal, with the edge that reached it and the depth at
 * which it was first found.
 */
public final class RelatedEntry {
    public final IndexedEntry entry;
    public final RelationshipEdge via;
    public final int depth;

    public RelatedEntry(IndexedEntry entry, RelationshipEdge via, int depth) {
        this.entry = Objects.requireNonNull(entry, "entry");
        this.via = Objects.requireNonNull(via, "via");
        this.depth = depth;
    }

    public RelationshipType relationshipType() {
        return via.type;
    }

    @Override
    public String toString() {
        return "RelatedEntry{" + entry.id() + ", " + via.type.id() + ", depth=" + depth + '}';
    }
}
