package org.calista.archives.lore.graph;

import java.util.*;

/**
 * Directed multigraph of entry relationships.
 *
 * <p>
 * Adjacency lists keyed by node id plus a reverse index for in-degree. Several edges between
 * the same ordered pair (of different types) coexist. Nodes are exactly the indexed entries;
 * an edge may point at an id that is not a node (broken reference), in which case it still
 * counts toward the source's out-degree.
 * </p>
 *
 * <p>Instances are immutable once built; a rebuild produces a new graph.</p>
 */
public final class RelationshipGraph {

    private static final RelationshipGraph EMPTY = new Builder().build();

    private final Set<String> nodes;
    private final Map<String, List<RelationshipEdge>> outgoing;
    private final Map<String, List<RelationshipEdge>> incoming;
    private final int edgeCount;

    private RelationshipGraph(Set<String> nodes,
                              Map<String, List<RelationshipEdge>> outgoing,
                              Map<String, List<RelationshipEdge>> incoming,
                              int edgeCount) {
        this.nodes = nodes;
        this.outgoing = outgoing;
        this.incoming = incoming;
        this.edgeCount = edgeCount;
    }

    public static RelationshipGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public boolean containsNode(String id) {
        return id != null && nodes.contains(id);
    }

    /** Node ids in insertion order. */
    public Set<String> nodes() {
        return nodes;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /** Outgoing edges of {@code id} in declaration order; empty for unknown ids. */
    public List<RelationshipEdge> outgoing(String id) {
        if (id == null) return List.of();
        return outgoing.getOrDefault(id, List.of());
    }

    public List<RelationshipEdge> incoming(String id) {
        if (id == null) return List.of();
        return incoming.getOrDefault(id, List.of());
    }

    public int outDegree(String id) {
        return outgoing(id).size();
    }

    public int inDegree(String id) {
        return incoming(id).size();
    }

    /** All edges, grouped by source in node order. */
    public List<RelationshipEdge> edges() {
        ArrayList<RelationshipEdge> out = new ArrayList<>(edgeCount);
        for (List<RelationshipEdge> es : outgoing.values()) out.addAll(es);
        return Collections.unmodifiableList(out);
    }

    /**
     * Induced subgraph over the given ids: the ids that are nodes here, and every edge whose
     * endpoints are both among them.
     */
    public RelationshipGraph subgraph(Collection<String> ids) {
        Objects.requireNonNull(ids, "ids");
        HashSet<String> keep = new HashSet<>(ids);

        Builder b = new Builder();
        for (String n : nodes) {
            if (keep.contains(n)) b.addNode(n);
        }
        for (String n : nodes) {
            if (!keep.contains(n)) continue;
            for (RelationshipEdge e : outgoing(n)) {
                if (keep.contains(e.targetId) && nodes.contains(e.targetId)) b.addEdge(e);
            }
        }
        return b.build();
    }

    @Override
    public String toString() {
        return "RelationshipGraph{nodes=" + nodes.size() + ", edges=" + edgeCount + '}';
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final LinkedHashSet<String> nodes = new LinkedHashSet<>();
        private final LinkedHashMap<String, List<RelationshipEdge>> outgoing = new LinkedHashMap<>();
        private final HashMap<String, List<RelationshipEdge>> incoming = new HashMap<>();
        private int edgeCount = 0;

        public Builder addNode(String id) {
            nodes.add(Objects.requireNonNull(id, "id"));
            return this;
        }

        public Builder addEdge(RelationshipEdge edge) {
            Objects.requireNonNull(edge, "edge");
            outgoing.computeIfAbsent(edge.sourceId, k -> new ArrayList<>()).add(edge);
            incoming.computeIfAbsent(edge.targetId, k -> new ArrayList<>()).add(edge);
            edgeCount++;
            return this;
        }

        public RelationshipGraph build() {
            LinkedHashMap<String, List<RelationshipEdge>> out = new LinkedHashMap<>();
            for (Map.Entry<String, List<RelationshipEdge>> e : outgoing.entrySet()) {
                out.put(e.getKey(), List.copyOf(e.getValue()));
            }
            HashMap<String, List<RelationshipEdge>> in = new HashMap<>();
            for (Map.Entry<String, List<RelationshipEdge>> e : incoming.entrySet()) {
                in.put(e.getKey(), List.copyOf(e.getValue()));
            }
            return new RelationshipGraph(
                    Collections.unmodifiableSet(new LinkedHashSet<>(nodes)),
                    Collections.unmodifiableMap(out),
                    Collections.unmodifiableMap(in),
                    edgeCount);
        }
    }
}
