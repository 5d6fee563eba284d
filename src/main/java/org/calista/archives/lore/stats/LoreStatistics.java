package org.calista.archives.lore.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.calista.archives.lore.graph.RelationshipEdge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one index snapshot.
 */
public final class LoreStatistics {

    @JsonProperty("total_entries")
    public final int totalEntries;

    /** Category id -> entry count, category order, only categories that have entries. */
    public final Map<String, Integer> categories;

    @JsonProperty("total_relationships")
    public final int totalRelationships;

    @JsonProperty("orphaned_entries")
    public final List<String> orphanedEntryIds;

    /** Edges whose target is not an indexed entry. */
    @JsonProperty("broken_references")
    public final List<RelationshipEdge> brokenReferences;

    public LoreStatistics(int totalEntries,
                          Map<String, Integer> categories,
                          int totalRelationships,
                          List<String> orphanedEntryIds,
                          List<RelationshipEdge> brokenReferences) {
        this.totalEntries = totalEntries;
        this.categories = categories == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(categories));
        this.totalRelationships = totalRelationships;
        this.orphanedEntryIds = orphanedEntryIds == null ? List.of() : List.copyOf(orphanedEntryIds);
        this.brokenReferences = brokenReferences == null ? List.of() : List.copyOf(brokenReferences);
    }

    @Override
    public String toString() {
        return "LoreStatistics{entries=" + totalEntries
                + ", relationships=" + totalRelationships
                + ", orphaned=" + orphanedEntryIds.size()
                + ", broken=" + brokenReferences.size() + '}';
    }
}
