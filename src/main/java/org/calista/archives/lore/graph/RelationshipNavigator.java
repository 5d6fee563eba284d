package org.calista.archives.lore.graph;

import org.calista.archives.lore.entry.RelationshipType;
import org.calista.archives.lore.index.IndexSnapshot;
import org.calista.archives.lore.index.IndexedEntry;

import java.util.*;

/**
 * Bounded breadth-first traversal over the relationship graph.
 *
 * <ul>
 *   <li>level 1 = direct successors of the start entry, level n = successors of level n-1</li>
 *   <li>the optional type filter applies to every traversed edge</li>
 *   <li>level 1 reports every matching edge, so parallel edges of different types to one target
 *       each produce a result</li>
 *   <li>from level 2 on, an entry already reported is skipped; the depth recorded is the one
 *       where it was first reached</li>
 *   <li>targets that are not indexed entries are neither reported nor expanded</li>
 * </ul>
 *
 * The start entry is not pre-marked: if a cycle leads back to it, it is reported once at
 * the depth where the cycle closes.
 */
public final class RelationshipNavigator {

    public List<RelatedEntry> related(IndexSnapshot snapshot, String entryId, RelationshipType type, int maxDepth) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (entryId == null || !snapshot.graph.containsNode(entryId)) return List.of();
        if (maxDepth < 1) return List.of();

        ArrayList<RelatedEntry> out = new ArrayList<>();
        HashSet<String> seen = new HashSet<>();

        List<String> frontier = List.of(entryId);
        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            ArrayList<String> next = new ArrayList<>();
            for (String from : frontier) {
                for (RelationshipEdge edge : snapshot.graph.outgoing(from)) {
                    if (type != null && edge.type != type) continue;
                    if (depth > 1 && seen.contains(edge.targetId)) continue;

                    Optional<IndexedEntry> target = snapshot.index.get(edge.targetId);
                    if (target.isEmpty()) continue;

                    out.add(new RelatedEntry(target.get(), edge, depth));
                    if (seen.add(edge.targetId)) next.add(edge.targetId);
                }
            }
            frontier = next;
        }
        return Collections.unmodifiableList(out);
    }
}
