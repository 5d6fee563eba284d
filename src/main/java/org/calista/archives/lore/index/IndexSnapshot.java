package org.calista.archives.lore.index;

import org.calista.archives.lore.graph.RelationshipGraph;

import java.util.Objects;

/**
 * Index and graph from the same build pass. Swapped as one reference so that readers never
 * see an index from one build paired with a graph from another.
 */
public final class IndexSnapshot {

    public final LoreIndex index;
    public final RelationshipGraph graph;
    public final BuildReport report;
    public final long builtAtEpochMs;

    public IndexSnapshot(LoreIndex index, RelationshipGraph graph, BuildReport report, long builtAtEpochMs) {
        this.index = Objects.requireNonNull(index, "index");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.report = Objects.requireNonNull(report, "report");
        this.builtAtEpochMs = builtAtEpochMs;
    }

    public static IndexSnapshot empty() {
        return new IndexSnapshot(LoreIndex.empty(), RelationshipGraph.empty(), BuildReport.empty(), 0L);
    }
}
