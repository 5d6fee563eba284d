package org.calista.archives.lore.stats;

import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.graph.RelationshipEdge;
import org.calista.archives.lore.graph.RelationshipGraph;
import org.calista.archives.lore.index.IndexSnapshot;
import org.calista.archives.lore.index.IndexedEntry;

import java.util.*;

/**
 * Computes {@link LoreStatistics} fresh from a snapshot; nothing is cached here.
 */
public final class StatisticsReporter {

    public LoreStatistics report(IndexSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        RelationshipGraph graph = snapshot.graph;

        EnumMap<Category, Integer> counts = new EnumMap<>(Category.class);
        ArrayList<String> orphaned = new ArrayList<>();
        for (IndexedEntry e : snapshot.index.entries()) {
            counts.merge(e.category(), 1, Integer::sum);
            if (graph.inDegree(e.id()) == 0 && graph.outDegree(e.id()) == 0) orphaned.add(e.id());
        }

        LinkedHashMap<String, Integer> byCategory = new LinkedHashMap<>();
        for (Map.Entry<Category, Integer> c : counts.entrySet()) byCategory.put(c.getKey().id(), c.getValue());

        ArrayList<RelationshipEdge> broken = new ArrayList<>();
        for (RelationshipEdge edge : graph.edges()) {
            if (!snapshot.index.contains(edge.targetId)) broken.add(edge);
        }

        return new LoreStatistics(snapshot.index.size(), byCategory, graph.edgeCount(), orphaned, broken);
    }
}
